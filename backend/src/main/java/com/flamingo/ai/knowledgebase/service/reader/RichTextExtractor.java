package com.flamingo.ai.knowledgebase.service.reader;

import com.flamingo.ai.knowledgebase.domain.FileType;
import com.flamingo.ai.knowledgebase.exception.ErrorCode;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import javax.xml.parsers.DocumentBuilderFactory;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.sax.ToXMLContentHandler;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Extracts Word documents through Apache Tika's XHTML output.
 *
 * <p>Paragraph, heading, list item and table cell text are emitted one per line in document
 * order.
 */
@Component
@Slf4j
public class RichTextExtractor implements TextExtractor {

  private static final Set<String> TEXT_BLOCKS =
      Set.of("p", "h1", "h2", "h3", "h4", "h5", "h6", "li", "td", "th");

  @Override
  public FileType fileType() {
    return FileType.RICH_TEXT;
  }

  @Override
  public ExtractionResult extract(Path path) {
    try (InputStream in = Files.newInputStream(path)) {
      List<String> lines = new ArrayList<>();
      collectBlocks(parseXhtml(in).getDocumentElement(), lines);
      String text = String.join("\n", lines);
      if (text.isBlank()) {
        return ExtractionResult.failure(
            ErrorCode.EMPTY_CONTENT, "Document contains no text: " + path);
      }
      return ExtractionResult.success(text, "tika");
    } catch (Exception e) {
      log.error("Tika parsing failed for {}: {}", path, e.getMessage());
      return ExtractionResult.failure(
          ErrorCode.CORRUPT_FILE, "Failed to parse document " + path + ": " + e.getMessage(), e);
    }
  }

  private org.w3c.dom.Document parseXhtml(InputStream in) throws Exception {
    AutoDetectParser tikaParser = new AutoDetectParser();
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ToXMLContentHandler handler = new ToXMLContentHandler(out, StandardCharsets.UTF_8.name());
    tikaParser.parse(in, handler, new Metadata());

    DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
    dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
    dbf.setNamespaceAware(true);
    return dbf.newDocumentBuilder().parse(new ByteArrayInputStream(out.toByteArray()));
  }

  private void collectBlocks(Element element, List<String> lines) {
    NodeList children = element.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node child = children.item(i);
      if (child.getNodeType() != Node.ELEMENT_NODE) {
        continue;
      }
      Element el = (Element) child;
      String tag = el.getLocalName() != null ? el.getLocalName() : el.getTagName();
      if (TEXT_BLOCKS.contains(tag.toLowerCase(Locale.ROOT))) {
        String text = el.getTextContent().trim();
        if (!text.isEmpty()) {
          lines.add(text);
        }
      } else {
        collectBlocks(el, lines);
      }
    }
  }
}
