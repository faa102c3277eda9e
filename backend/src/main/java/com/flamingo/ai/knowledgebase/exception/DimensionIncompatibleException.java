package com.flamingo.ai.knowledgebase.exception;

import java.util.Map;

/** Exception thrown when vectors of a different length would be mixed into one collection. */
public class DimensionIncompatibleException extends KnowledgeBaseException {

  private final String modelName;
  private final int expectedDimension;
  private final int actualDimension;

  public DimensionIncompatibleException(
      String collectionName, String modelName, int expectedDimension, int actualDimension) {
    super(
        ErrorCode.DIMENSION_INCOMPATIBLE,
        String.format(
            "Collection '%s' stores %d-dimensional vectors but model '%s' produced %d",
            collectionName, expectedDimension, modelName, actualDimension),
        Map.of(
            "collection", collectionName,
            "modelName", modelName,
            "expectedDimension", expectedDimension,
            "actualDimension", actualDimension),
        null);
    this.modelName = modelName;
    this.expectedDimension = expectedDimension;
    this.actualDimension = actualDimension;
  }

  public String getModelName() {
    return modelName;
  }

  public int getExpectedDimension() {
    return expectedDimension;
  }

  public int getActualDimension() {
    return actualDimension;
  }
}
