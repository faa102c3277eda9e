package com.flamingo.ai.knowledgebase.service.reader;

import com.flamingo.ai.knowledgebase.domain.FileType;
import java.nio.file.Path;

/** Extracts plain text from one file format. */
public interface TextExtractor {

  FileType fileType();

  ExtractionResult extract(Path path);
}
