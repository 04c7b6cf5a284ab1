/**
 * SMTP delivery for the mail queue, built on Jakarta Mail (Eclipse Angus).
 *
 * @see mailqueue.smtp.SmtpMailTransport
 * @see mailqueue.smtp.SmtpConnectionUri
 */
package mailqueue.smtp;
