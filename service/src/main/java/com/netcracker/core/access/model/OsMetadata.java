package com.netcracker.core.access.model;

/**
 * OS hints reported by the provider for a target. Every field is optional;
 * absent values are empty strings or {@code false}.
 */
public record OsMetadata(boolean windowsConfiguration,
                         boolean linuxConfiguration,
                         String osDiskType,
                         String imagePublisher,
                         String imageOffer,
                         String imageSku) {

    public static final OsMetadata EMPTY = new OsMetadata(false, false, "", "", "", "");

    public OsMetadata {
        osDiskType = osDiskType == null ? "" : osDiskType;
        imagePublisher = imagePublisher == null ? "" : imagePublisher;
        imageOffer = imageOffer == null ? "" : imageOffer;
        imageSku = imageSku == null ? "" : imageSku;
    }
}
