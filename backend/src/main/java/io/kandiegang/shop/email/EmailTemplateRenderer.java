package io.kandiegang.shop.email;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

/**
 * Renders branded HTML emails from the Thymeleaf templates under {@code templates/email/}. The
 * content template is rendered first and then wrapped in the {@code base} layout.
 */
@Service
public class EmailTemplateRenderer {

  private static final Logger log = LoggerFactory.getLogger(EmailTemplateRenderer.class);

  static final String TEMPLATE_PREFIX = "templates/email/";

  private static final Pattern HEAD = Pattern.compile("(?s)<head>.*?</head>");
  private static final Pattern LINK =
      Pattern.compile("<a[^>]*href=\"([^\"]*)\"[^>]*>([^<]*)</a>");
  private static final Pattern LINE_BREAK = Pattern.compile("<br\\s*/?>");
  private static final Pattern PARAGRAPH_END = Pattern.compile("</p>");
  private static final Pattern BLOCK_END = Pattern.compile("</(div|li|h1|h2|ul)>");
  private static final Pattern TAG = Pattern.compile("<[^>]+>");
  private static final Pattern INLINE_SPACE = Pattern.compile("[ \t]+");
  private static final Pattern LEADING_SPACE = Pattern.compile("(?m)^ +");
  private static final Pattern EXTRA_BLANK_LINES = Pattern.compile("\\n{3,}");

  // &amp; last, so "&amp;lt;" stays literal
  private static final Map<String, String> ENTITIES = new LinkedHashMap<>();

  static {
    ENTITIES.put("&lt;", "<");
    ENTITIES.put("&gt;", ">");
    ENTITIES.put("&quot;", "\"");
    ENTITIES.put("&#39;", "'");
    ENTITIES.put("&nbsp;", " ");
    ENTITIES.put("&amp;", "&");
  }

  private final TemplateEngine emailTemplateEngine;

  public EmailTemplateRenderer() {
    this.emailTemplateEngine = createEmailTemplateEngine();
  }

  /**
   * @param templateName template name without path or suffix (e.g., "member-welcome")
   * @param subject subject line, also exposed to the templates as {@code subject}
   */
  public RenderedEmail render(String templateName, String subject, Map<String, Object> variables) {
    var ctx = new Context();
    variables.forEach(ctx::setVariable);
    ctx.setVariable("subject", subject);

    String contentHtml = emailTemplateEngine.process(templateName, ctx);
    ctx.setVariable("contentHtml", contentHtml);
    String fullHtml = emailTemplateEngine.process("base", ctx);

    log.debug("Rendered email template '{}', HTML size={}", templateName, fullHtml.length());
    return new RenderedEmail(subject, fullHtml, toPlainText(fullHtml));
  }

  /** Strips tags for the plain-text part. Links keep their URL in parentheses. */
  String toPlainText(String html) {
    if (html == null || html.isBlank()) {
      return "";
    }
    String text = HEAD.matcher(html).replaceAll("");
    text = LINK.matcher(text).replaceAll("$2 ($1)");
    text = LINE_BREAK.matcher(text).replaceAll("\n");
    text = PARAGRAPH_END.matcher(text).replaceAll("\n\n");
    text = BLOCK_END.matcher(text).replaceAll("\n");
    text = TAG.matcher(text).replaceAll("");
    for (var entity : ENTITIES.entrySet()) {
      text = text.replace(entity.getKey(), entity.getValue());
    }
    text = INLINE_SPACE.matcher(text).replaceAll(" ");
    text = LEADING_SPACE.matcher(text).replaceAll("");
    text = EXTRA_BLANK_LINES.matcher(text).replaceAll("\n\n");
    return text.strip();
  }

  private static TemplateEngine createEmailTemplateEngine() {
    var resolver = new ClassLoaderTemplateResolver();
    resolver.setTemplateMode(TemplateMode.HTML);
    resolver.setPrefix(TEMPLATE_PREFIX);
    resolver.setSuffix(".html");
    resolver.setCharacterEncoding(StandardCharsets.UTF_8.name());
    resolver.setCacheable(true);

    var engine = new TemplateEngine();
    engine.setTemplateResolver(resolver);
    return engine;
  }
}
