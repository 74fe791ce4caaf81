package com.largomodo.photocollage.core;

/**
 * Output formats written for every collage.
 */
public enum OutputFormat {
    PNG("png", "png", true),    // lossless, keeps alpha
    JPEG("jpg", "jpeg", false); // lossy, flattened onto white

    private final String fileExtension;
    private final String imageIoName;
    private final boolean preservesAlpha;

    OutputFormat(String fileExtension, String imageIoName, boolean preservesAlpha) {
        this.fileExtension = fileExtension;
        this.imageIoName = imageIoName;
        this.preservesAlpha = preservesAlpha;
    }

    public String getFileExtension() {
        return fileExtension;
    }

    public String getImageIoName() {
        return imageIoName;
    }

    public boolean preservesAlpha() {
        return preservesAlpha;
    }

    public String fileName(String baseName) {
        return baseName + "." + fileExtension;
    }
}
