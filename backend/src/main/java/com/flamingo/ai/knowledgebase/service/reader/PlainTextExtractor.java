package com.flamingo.ai.knowledgebase.service.reader;

import com.flamingo.ai.knowledgebase.domain.FileType;
import com.flamingo.ai.knowledgebase.exception.ErrorCode;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Reads text files, trying each candidate encoding until one decodes without error. */
@Component
@Slf4j
public class PlainTextExtractor implements TextExtractor {

  static final List<Charset> ENCODINGS =
      List.of(
          StandardCharsets.UTF_8,
          Charset.forName("Shift_JIS"),
          Charset.forName("EUC-JP"),
          Charset.forName("windows-31j"));

  private static final char BOM = '\uFEFF';

  @Override
  public FileType fileType() {
    return FileType.TEXT;
  }

  @Override
  public ExtractionResult extract(Path path) {
    ExtractionResult decoded = decode(path);
    if (decoded instanceof ExtractionResult.Success success && success.text().isBlank()) {
      return ExtractionResult.failure(ErrorCode.EMPTY_CONTENT, "Text file is empty: " + path);
    }
    return decoded;
  }

  /** Decodes the file without judging its content. */
  ExtractionResult decode(Path path) {
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(path);
    } catch (IOException e) {
      return ExtractionResult.failure(
          ErrorCode.CORRUPT_FILE, "Cannot read " + path + ": " + e.getMessage(), e);
    }
    for (Charset charset : ENCODINGS) {
      try {
        String text =
            charset
                .newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        if (!text.isEmpty() && text.charAt(0) == BOM) {
          text = text.substring(1);
        }
        log.debug("Decoded {} as {}", path, charset.name());
        return ExtractionResult.success(text, charset.name());
      } catch (CharacterCodingException e) {
        log.debug("{} is not valid {}", path, charset.name());
      }
    }
    return ExtractionResult.failure(
        ErrorCode.ENCODING_ERROR, "No supported encoding could decode " + path);
  }
}
