package mailqueue.template;

import org.thymeleaf.IEngineConfiguration;
import org.thymeleaf.cache.AlwaysValidCacheEntryValidity;
import org.thymeleaf.cache.ICacheEntryValidity;
import org.thymeleaf.cache.NonCacheableCacheEntryValidity;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.AbstractTemplateResolver;
import org.thymeleaf.templateresource.ITemplateResource;
import org.thymeleaf.templateresource.StringTemplateResource;

import java.io.Reader;
import java.util.Map;
import java.util.function.Function;

/**
 * Resolves template names against the loaded templates collection.
 *
 * <p>Names take the form {@code <document>/<field>} (e.g. {@code welcome/html}) or
 * {@code <document>/attachments/<index>/<key>}. A bare name such as {@code footer} refers to a
 * partial and resolves to the partial's field matching the including template, falling back to
 * its {@code html}. {@code subject} and {@code text} render in TEXT mode, everything else in
 * HTML mode.
 */
final class DocumentTemplateResolver extends AbstractTemplateResolver {

  private final Function<String, TemplateDocument> documents;

  DocumentTemplateResolver(Function<String, TemplateDocument> documents) {
    this.documents = documents;
    setName("mailqueue-templates");
    setCheckExistence(true);
  }

  @Override
  protected ITemplateResource computeTemplateResource(IEngineConfiguration configuration, String ownerTemplate,
      String template, Map<String, Object> templateResolutionAttributes) {
    String source = lookup(ownerTemplate, template);
    return source != null ? new StringTemplateResource(source) : new MissingResource(template);
  }

  @Override
  protected TemplateMode computeTemplateMode(IEngineConfiguration configuration, String ownerTemplate,
      String template, Map<String, Object> templateResolutionAttributes) {
    return modeOf(isPartialReference(template) ? ownerTemplate : template);
  }

  @Override
  protected ICacheEntryValidity computeValidity(IEngineConfiguration configuration, String ownerTemplate,
      String template, Map<String, Object> templateResolutionAttributes) {
    // Bare partial names resolve differently per owner.
    return isPartialReference(template)
        ? NonCacheableCacheEntryValidity.INSTANCE
        : AlwaysValidCacheEntryValidity.INSTANCE;
  }

  static TemplateMode modeOf(String template) {
    if (template == null) {
      return TemplateMode.HTML;
    }
    String field = fieldOf(template);
    return field.equals("subject") || field.equals("text") || field.startsWith("attachments/")
        ? TemplateMode.TEXT
        : TemplateMode.HTML;
  }

  private String lookup(String ownerTemplate, String template) {
    if (isPartialReference(template)) {
      TemplateDocument partial = documents.apply(template);
      if (partial == null || !partial.partial()) {
        return null;
      }
      String field = ownerTemplate == null ? "html" : fieldOf(ownerTemplate);
      String source = partial.source(field);
      return source != null ? source : partial.source("html");
    }
    int slash = template.indexOf('/');
    TemplateDocument document = documents.apply(template.substring(0, slash));
    return document == null ? null : document.source(template.substring(slash + 1));
  }

  private static boolean isPartialReference(String template) {
    return template.indexOf('/') < 0;
  }

  private static String fieldOf(String template) {
    int slash = template.indexOf('/');
    return slash < 0 ? "html" : template.substring(slash + 1);
  }

  private record MissingResource(String template) implements ITemplateResource {
    @Override
    public String getDescription() {
      return template;
    }

    @Override
    public String getBaseName() {
      return template;
    }

    @Override
    public boolean exists() {
      return false;
    }

    @Override
    public Reader reader() {
      throw new IllegalStateException("Template does not exist: " + template);
    }

    @Override
    public ITemplateResource relative(String relativeLocation) {
      return new MissingResource(relativeLocation);
    }
  }
}
