package com.flamingo.ai.knowledgebase.service.reader;

import com.flamingo.ai.knowledgebase.domain.FileType;
import com.flamingo.ai.knowledgebase.exception.ErrorCode;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

/** Extracts PDF text page by page with Apache PDFBox. */
@Component
@Slf4j
public class PdfTextExtractor implements TextExtractor {

  @Override
  public FileType fileType() {
    return FileType.PDF;
  }

  @Override
  public ExtractionResult extract(Path path) {
    try (PDDocument pdf = Loader.loadPDF(path.toFile())) {
      PDFTextStripper stripper = new PDFTextStripper();
      List<String> pages = new ArrayList<>();
      for (int page = 1; page <= pdf.getNumberOfPages(); page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        pages.add(stripper.getText(pdf));
      }
      String text = String.join("\n", pages);
      if (text.isBlank()) {
        return ExtractionResult.failure(
            ErrorCode.EMPTY_CONTENT, "No text could be extracted from PDF " + path);
      }
      log.debug("Extracted {} page(s) from {}", pages.size(), path);
      return ExtractionResult.success(text, "pdfbox");
    } catch (IOException e) {
      log.error("PDFBox parsing failed for {}: {}", path, e.getMessage());
      return ExtractionResult.failure(
          ErrorCode.CORRUPT_FILE, "Failed to parse PDF " + path + ": " + e.getMessage(), e);
    }
  }
}
