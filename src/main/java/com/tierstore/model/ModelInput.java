package com.tierstore.model;

import java.util.Base64;

/**
 * Text or image handed to a model capability.
 */
public record ModelInput(String text, byte[] image, String mimeType) {

    public static ModelInput text(String text) {
        return new ModelInput(text == null ? "" : text, null, null);
    }

    public static ModelInput image(byte[] bytes, String mimeType) {
        return new ModelInput(null, bytes, mimeType == null ? "application/octet-stream" : mimeType);
    }

    public boolean isImage() {
        return image != null;
    }

    public String dataUrl() {
        if (image == null) {
            throw new IllegalStateException("not an image input");
        }
        return "data:" + mimeType + ";base64," + Base64.getEncoder().encodeToString(image);
    }
}
