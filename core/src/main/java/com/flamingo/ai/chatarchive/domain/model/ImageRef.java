package com.flamingo.ai.chatarchive.domain.model;

/**
 * Reference to an image attached to a multimodal message. The image bytes are not part of the
 * export file; only the pointer and the dimensions the provider recorded are kept.
 *
 * @param assetPointer provider asset URI, e.g. {@code file-service://file-abc}
 * @param sizeBytes size of the asset in bytes, or {@code null} when not recorded
 * @param width pixel width, or {@code null}
 * @param height pixel height, or {@code null}
 */
public record ImageRef(String assetPointer, Long sizeBytes, Integer width, Integer height) {

  public ImageRef {
    if (assetPointer == null || assetPointer.isBlank()) {
      throw new IllegalArgumentException("Image asset pointer must not be blank");
    }
  }
}
