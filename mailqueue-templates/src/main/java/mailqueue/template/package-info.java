/**
 * Template rendering for {@code message.template}, backed by a collection of template documents.
 *
 * @see mailqueue.template.DocumentTemplateRenderer
 */
package mailqueue.template;
