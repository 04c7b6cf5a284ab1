package mailqueue.template;

import mailqueue.spi.DocumentChange;
import mailqueue.spi.DocumentSnapshot;
import mailqueue.spi.DocumentStore;
import mailqueue.spi.TemplateException;
import mailqueue.spi.TemplateRenderer;
import mailqueue.trigger.ChangeListener;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.exceptions.TemplateEngineException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link TemplateRenderer} over a collection of template documents, rendered with Thymeleaf.
 *
 * <p>Each document is one template named by its id, with optional {@code subject}, {@code html},
 * {@code text} and {@code amp} fields and an optional {@code attachments} list. {@code subject},
 * {@code text} and attachment strings use Thymeleaf TEXT mode ({@code Hello [[${name}]]});
 * {@code html} and {@code amp} use HTML mode with escaping. Documents with {@code partial: true}
 * cannot be rendered directly but can be included by name from other templates:
 *
 * <pre>{@code
 * <footer th:replace="~{footer}"></footer>     (html)
 * [# th:insert="~{footer}" /]                  (text)
 * }</pre>
 *
 * <p>The collection is loaded on first use and kept current through {@link #onChange}, which
 * {@code MailQueue} wires to the templates collection when this renderer is configured.
 */
public final class DocumentTemplateRenderer implements TemplateRenderer, ChangeListener {
  private static final Logger logger = Logger.getLogger(DocumentTemplateRenderer.class.getName());

  private final DocumentStore store;
  private final String collection;
  private final TemplateEngine engine;
  private volatile Map<String, TemplateDocument> templates;

  public DocumentTemplateRenderer(DocumentStore store, String collection) {
    this.store = Objects.requireNonNull(store, "store");
    this.collection = Objects.requireNonNull(collection, "collection");
    this.engine = new TemplateEngine();
    engine.setTemplateResolver(new DocumentTemplateResolver(name -> loaded().get(name)));
  }

  public String collection() {
    return collection;
  }

  @Override
  public Map<String, Object> render(String name, Map<String, Object> data) throws TemplateException {
    TemplateDocument template = loaded().get(name);
    if (template == null || template.partial()) {
      throw new TemplateException("Tried to render non-existent template '" + name + "'");
    }
    Context context = new Context();
    context.setVariables(data);

    Map<String, Object> rendered = new LinkedHashMap<>();
    try {
      for (String field : template.fields().keySet()) {
        rendered.put(field, engine.process(name + "/" + field, context));
      }
      if (!template.attachments().isEmpty()) {
        rendered.put("attachments", renderAttachments(name, template.attachments(), context));
      }
    } catch (TemplateEngineException e) {
      throw new TemplateException("Failed to render template '" + name + "': " + e.getMessage(), e);
    }
    return rendered;
  }

  private List<Map<String, Object>> renderAttachments(String name, List<Map<String, Object>> attachments,
      Context context) {
    List<Map<String, Object>> rendered = new ArrayList<>(attachments.size());
    for (int i = 0; i < attachments.size(); i++) {
      Map<String, Object> attachment = new LinkedHashMap<>();
      for (Map.Entry<String, Object> entry : attachments.get(i).entrySet()) {
        attachment.put(entry.getKey(), entry.getValue() instanceof String
            ? engine.process(name + "/attachments/" + i + "/" + entry.getKey(), context)
            : entry.getValue());
      }
      rendered.add(attachment);
    }
    return rendered;
  }

  /**
   * Applies a change of the templates collection.
   */
  @Override
  public void onChange(DocumentChange change) {
    if (!collection.equals(change.ref().collection())) {
      return;
    }
    synchronized (this) {
      if (templates == null) {
        // Not loaded yet; the first render reads the current collection.
        return;
      }
      Map<String, TemplateDocument> updated = new HashMap<>(templates);
      String name = change.ref().id();
      if (change.isDelete()) {
        updated.remove(name);
      } else {
        updated.put(name, TemplateDocument.from(name, change.after().data()));
      }
      templates = Collections.unmodifiableMap(updated);
      engine.clearTemplateCache();
    }
    logger.log(Level.FINE, "Template '" + change.ref().id() + "' " + (change.isDelete() ? "removed" : "updated"));
  }

  /**
   * Reloads every template from the collection.
   */
  public synchronized void refresh() {
    Map<String, TemplateDocument> loaded = new HashMap<>();
    for (DocumentSnapshot snapshot : store.list(collection)) {
      loaded.put(snapshot.ref().id(), TemplateDocument.from(snapshot.ref().id(), snapshot.data()));
    }
    templates = Collections.unmodifiableMap(loaded);
    engine.clearTemplateCache();
    logger.log(Level.INFO, "Loaded " + loaded.size() + " template(s) from '" + collection + "'");
  }

  private Map<String, TemplateDocument> loaded() {
    Map<String, TemplateDocument> current = templates;
    if (current == null) {
      synchronized (this) {
        if (templates == null) {
          refresh();
        }
        current = templates;
      }
    }
    return current;
  }
}
