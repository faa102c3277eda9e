package com.flamingo.ai.knowledgebase.service.reader;

import com.flamingo.ai.knowledgebase.exception.ErrorCode;
import java.util.ArrayList;
import java.util.List;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.BulletList;
import org.commonmark.node.Code;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.Heading;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.Text;
import org.commonmark.parser.Parser;

/**
 * Walks the commonmark-java AST and emits headings, paragraphs and list items as plain lines.
 */
class StructuredMarkdownStrategy implements MarkdownStrategy {

  private static final Parser PARSER = Parser.builder().build();

  @Override
  public String name() {
    return "commonmark";
  }

  @Override
  public ExtractionResult apply(String markdown) {
    Node document = PARSER.parse(markdown);
    LineCollector collector = new LineCollector();
    document.accept(collector);
    String text = String.join("\n", collector.lines);
    if (text.isBlank()) {
      return ExtractionResult.failure(ErrorCode.EMPTY_CONTENT, "Markdown produced no text");
    }
    return ExtractionResult.success(text, name());
  }

  private static final class LineCollector extends AbstractVisitor {

    private final List<String> lines = new ArrayList<>();

    @Override
    public void visit(Heading heading) {
      addLine(inlineText(heading));
    }

    @Override
    public void visit(Paragraph paragraph) {
      if (paragraph.getParent() instanceof ListItem) {
        return;
      }
      addLine(inlineText(paragraph));
    }

    @Override
    public void visit(BulletList list) {
      visitItems(list);
    }

    @Override
    public void visit(OrderedList list) {
      visitItems(list);
    }

    @Override
    public void visit(FencedCodeBlock codeBlock) {
      addLine(codeBlock.getLiteral().stripTrailing());
    }

    @Override
    public void visit(IndentedCodeBlock codeBlock) {
      addLine(codeBlock.getLiteral().stripTrailing());
    }

    private void visitItems(Node list) {
      for (Node item = list.getFirstChild(); item != null; item = item.getNext()) {
        for (Node block = item.getFirstChild(); block != null; block = block.getNext()) {
          if (block instanceof Paragraph) {
            addLine(inlineText(block));
          } else {
            block.accept(this);
          }
        }
      }
    }

    private void addLine(String line) {
      if (!line.isBlank()) {
        lines.add(line.trim());
      }
    }

    private static String inlineText(Node node) {
      StringBuilder sb = new StringBuilder();
      node.accept(
          new AbstractVisitor() {
            @Override
            public void visit(Text text) {
              sb.append(text.getLiteral());
            }

            @Override
            public void visit(Code code) {
              sb.append(code.getLiteral());
            }

            @Override
            public void visit(SoftLineBreak softLineBreak) {
              sb.append(' ');
            }
          });
      return sb.toString();
    }
  }
}
