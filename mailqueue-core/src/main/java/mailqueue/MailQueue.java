package mailqueue;

import mailqueue.delivery.DeliveryBacklog;
import mailqueue.delivery.DeliveryDispatcher;
import mailqueue.delivery.DeliveryStateMachine;
import mailqueue.directory.DocumentUserDirectory;
import mailqueue.model.MessageFields;
import mailqueue.payload.PayloadPreparer;
import mailqueue.payload.RecipientResolver;
import mailqueue.payload.TemplateExpander;
import mailqueue.spi.DocumentChange;
import mailqueue.spi.DocumentRef;
import mailqueue.spi.DocumentSnapshot;
import mailqueue.spi.DocumentStore;
import mailqueue.spi.MailTransport;
import mailqueue.spi.MetricsExporter;
import mailqueue.spi.TemplateRenderer;
import mailqueue.spi.UserDirectory;
import mailqueue.transport.InMemoryMailTransport;
import mailqueue.transport.MailTransports;
import mailqueue.trigger.ChangeListener;
import mailqueue.trigger.ChangeTrigger;
import mailqueue.trigger.DefaultChangeListenerRegistry;
import mailqueue.trigger.TriggerChangeHook;
import mailqueue.util.Lazy;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires a document store, a {@link ChangeTrigger} and a
 * {@link DeliveryDispatcher} into a single {@link AutoCloseable} unit.
 *
 * <p>Once built, every message document created in the configured collection is delivered:
 * the queue initializes its {@code delivery} record, claims it, sends it, and records the
 * outcome on the document.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (MailQueue queue = MailQueue.builder()
 *     .documentStore(store)
 *     .config(new MailQueueConfig().setDefaultFrom("noreply@example.com"))
 *     .transportFactory(() -> SmtpMailTransport.fromUri(uri))
 *     .build()) {
 *   queue.send(Map.of("to", "someone@example.com", "subject", "Hi", "text", "Hello"));
 * }
 * }</pre>
 */
public final class MailQueue implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(MailQueue.class.getName());

  private final DocumentStore documentStore;
  private final MailQueueConfig config;
  private final DeliveryStateMachine stateMachine;
  private final DeliveryDispatcher dispatcher;
  private final ChangeTrigger trigger;
  private final TriggerChangeHook hook;
  private final Lazy<MailTransport> transport;
  private final MetricsExporter metrics;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private MailQueue(Builder builder) {
    this.documentStore = Objects.requireNonNull(builder.documentStore, "documentStore");
    this.config = builder.config != null ? builder.config : new MailQueueConfig();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();

    Supplier<? extends MailTransport> transportFactory = builder.transportFactory;
    if (transportFactory == null) {
      String uri = config.getSmtpConnectionUri();
      if (config.isTesting()) {
        transportFactory = InMemoryMailTransport::new;
      } else if (uri != null) {
        transportFactory = () -> MailTransports.fromUri(uri);
      } else {
        throw new IllegalStateException(
            "A transport, transportFactory or smtpConnectionUri is required unless testing is enabled");
      }
    }
    this.transport = Lazy.of(transportFactory);

    UserDirectory userDirectory = builder.userDirectory;
    if (userDirectory == null && config.getUsersCollection() != null) {
      userDirectory = new DocumentUserDirectory(documentStore, config.getUsersCollection());
    }

    this.stateMachine = new DeliveryStateMachine(documentStore, clock, config.getLeaseDuration(), metrics);
    PayloadPreparer payloadPreparer = new PayloadPreparer(
        new TemplateExpander(builder.templateRenderer),
        new RecipientResolver(userDirectory),
        config.getDefaultFrom(),
        config.getDefaultReplyTo());
    this.dispatcher = new DeliveryDispatcher(stateMachine, payloadPreparer, transport, metrics);

    DefaultChangeListenerRegistry registry = new DefaultChangeListenerRegistry()
        .register(config.getCollection(), dispatcher);
    DeliveryBacklog backlog = new DeliveryBacklog(documentStore, config.getCollection());
    Supplier<List<DocumentChange>> recovery = backlog;
    if (builder.templateRenderer instanceof ChangeListener templateListener
        && config.getTemplatesCollection() != null) {
      registry.register(config.getTemplatesCollection(), templateListener);
      String templates = config.getTemplatesCollection();
      recovery = () -> {
        List<DocumentChange> changes = new ArrayList<>(templateChanges(templates));
        changes.addAll(backlog.get());
        return changes;
      };
    }
    for (Map.Entry<String, ChangeListener> entry : builder.listeners.entrySet()) {
      registry.register(entry.getKey(), entry.getValue());
    }

    this.trigger = ChangeTrigger.builder()
        .listenerRegistry(registry)
        .workerCount(config.getTriggerWorkers())
        .queueCapacity(config.getTriggerQueueCapacity())
        .drainTimeoutMs(config.getDrainTimeoutMs())
        .metrics(metrics)
        .recovery(recovery)
        .build();
    this.hook = new TriggerChangeHook(trigger, metrics);
    documentStore.addChangeHook(hook);
    logger.log(Level.INFO, "Initialized mail queue with configuration: " + config);
  }

  // Template updates can be rejected along with messages; deletions are not replayed.
  private List<DocumentChange> templateChanges(String templates) {
    List<DocumentChange> changes = new ArrayList<>();
    for (DocumentSnapshot snapshot : documentStore.list(templates)) {
      changes.add(new DocumentChange(snapshot, snapshot));
    }
    return changes;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a message document in the configured collection.
   *
   * @param message the {@code message} map (recipients, subject, body, template, ...)
   * @return the new document
   */
  public DocumentRef send(Map<String, Object> message) {
    Objects.requireNonNull(message, "message");
    if (closed.get()) {
      throw new IllegalStateException("MailQueue is closed");
    }
    DocumentRef ref = DocumentRef.newRef(config.getCollection());
    Map<String, Object> data = new LinkedHashMap<>();
    data.put(MessageFields.MESSAGE, message);
    documentStore.create(ref, data);
    return ref;
  }

  public MailQueueConfig config() {
    return config;
  }

  public DocumentStore documentStore() {
    return documentStore;
  }

  public DeliveryStateMachine stateMachine() {
    return stateMachine;
  }

  public DeliveryDispatcher dispatcher() {
    return dispatcher;
  }

  /**
   * The shared transport, created on first use.
   */
  public MailTransport transport() {
    return transport.get();
  }

  /**
   * Detaches from the store, drains pending changes, then closes the transport and metrics
   * if they are closeable.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    RuntimeException first = null;
    documentStore.removeChangeHook(hook);
    try {
      trigger.close();
    } catch (RuntimeException e) {
      first = e;
    }
    MailTransport created = transport.getIfInitialized();
    if (created instanceof AutoCloseable closeable) {
      first = closeQuietly(closeable, first);
    }
    if (metrics instanceof AutoCloseable closeable) {
      first = closeQuietly(closeable, first);
    }
    if (first != null) {
      throw first;
    }
  }

  private static RuntimeException closeQuietly(AutoCloseable closeable, RuntimeException first) {
    try {
      closeable.close();
    } catch (Exception e) {
      RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
      if (first == null) return re;
      first.addSuppressed(re);
    }
    return first;
  }

  /** Builder for {@link MailQueue}. */
  public static final class Builder {
    private DocumentStore documentStore;
    private MailQueueConfig config;
    private Supplier<? extends MailTransport> transportFactory;
    private TemplateRenderer templateRenderer;
    private UserDirectory userDirectory;
    private Clock clock;
    private MetricsExporter metrics;
    private final Map<String, ChangeListener> listeners = new LinkedHashMap<>();

    private Builder() {}

    /**
     * <p><b>Required.</b>
     *
     * @param documentStore the store holding message documents
     * @return this builder
     */
    public Builder documentStore(DocumentStore documentStore) {
      this.documentStore = documentStore;
      return this;
    }

    /**
     * Optional. Defaults to {@code new MailQueueConfig()}.
     *
     * @param config queue settings
     * @return this builder
     */
    public Builder config(MailQueueConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Sets an already created transport.
     *
     * @param transport the transport shared by all deliveries
     * @return this builder
     */
    public Builder transport(MailTransport transport) {
      Objects.requireNonNull(transport, "transport");
      this.transportFactory = () -> transport;
      return this;
    }

    /**
     * Sets a factory called once, on the first delivery attempt. Without one, the transport is
     * created from {@link MailQueueConfig#getSmtpConnectionUri()} by a
     * {@link mailqueue.spi.MailTransportProvider} on the class path, or is in-memory when
     * {@link MailQueueConfig#isTesting()} is set.
     *
     * @param transportFactory creates the transport
     * @return this builder
     */
    public Builder transportFactory(Supplier<? extends MailTransport> transportFactory) {
      this.transportFactory = transportFactory;
      return this;
    }

    /**
     * Optional. Without a renderer, {@code message.template} is not rendered. A renderer that
     * is also a {@link ChangeListener} is registered for the templates collection.
     *
     * @param templateRenderer the renderer
     * @return this builder
     */
    public Builder templateRenderer(TemplateRenderer templateRenderer) {
      this.templateRenderer = templateRenderer;
      return this;
    }

    /**
     * Optional. Defaults to a {@link DocumentUserDirectory} over
     * {@link MailQueueConfig#getUsersCollection()} if one is configured.
     *
     * @param userDirectory uid lookup
     * @return this builder
     */
    public Builder userDirectory(UserDirectory userDirectory) {
      this.userDirectory = userDirectory;
      return this;
    }

    /**
     * Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock time source for delivery timestamps and leases
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Registers an additional listener for changes in another collection.
     *
     * @param collection the collection path
     * @param listener   the listener
     * @return this builder
     */
    public Builder changeListener(String collection, ChangeListener listener) {
      listeners.put(Objects.requireNonNull(collection, "collection"),
          Objects.requireNonNull(listener, "listener"));
      return this;
    }

    /**
     * Builds the queue and attaches it to the store. Worker threads start immediately.
     *
     * @throws NullPointerException  if {@code documentStore} is null
     * @throws IllegalStateException if no transport, factory or connection URI is configured
     *                               and testing is off
     */
    public MailQueue build() {
      return new MailQueue(this);
    }
  }
}
