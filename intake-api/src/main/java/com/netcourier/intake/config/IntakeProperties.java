package com.netcourier.intake.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "intake")
public class IntakeProperties {

    /**
     * Directory receiving stored uploads and per-run OCR scratch directories.
     */
    private String uploadDir = "uploads";

    /**
     * JSON file holding the document type taxonomy.
     */
    private String taxonomyFile = "types.json";

    /**
     * Model used when an upload does not name one.
     */
    private String defaultModel = "gemma3n:e4b-it-fp16";

    /**
     * Number of leading characters of the extracted text embedded in the classification prompt.
     */
    private int maxPromptChars = 3000;

    private final Ocr ocr = new Ocr();

    private final Retention retention = new Retention();

    private final Multipart multipart = new Multipart();

    public String getUploadDir() {
        return uploadDir;
    }

    public void setUploadDir(String uploadDir) {
        this.uploadDir = uploadDir;
    }

    public Path uploadPath() {
        return Path.of(uploadDir);
    }

    public String getTaxonomyFile() {
        return taxonomyFile;
    }

    public void setTaxonomyFile(String taxonomyFile) {
        this.taxonomyFile = taxonomyFile;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    public void setDefaultModel(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public int getMaxPromptChars() {
        return maxPromptChars;
    }

    public void setMaxPromptChars(int maxPromptChars) {
        this.maxPromptChars = maxPromptChars;
    }

    public Ocr getOcr() {
        return ocr;
    }

    public Retention getRetention() {
        return retention;
    }

    public Multipart getMultipart() {
        return multipart;
    }

    public static class Ocr {

        /**
         * File extensions, without the dot, that are routed through OCR instead of direct extraction.
         */
        private List<String> extensions = new ArrayList<>(List.of("pdf", "png", "jpg", "jpeg", "bmp"));

        private String language = "eng+rus";

        private String datapath;

        private int dpi = 300;

        public List<String> getExtensions() {
            return extensions;
        }

        public void setExtensions(List<String> extensions) {
            this.extensions = extensions;
        }

        public String getLanguage() {
            return language;
        }

        public void setLanguage(String language) {
            this.language = language;
        }

        public String getDatapath() {
            return datapath;
        }

        public void setDatapath(String datapath) {
            this.datapath = datapath;
        }

        public int getDpi() {
            return dpi;
        }

        public void setDpi(int dpi) {
            this.dpi = dpi;
        }
    }

    public static class Retention {

        private boolean keepUploads = true;

        private boolean keepScratch = true;

        public boolean isKeepUploads() {
            return keepUploads;
        }

        public void setKeepUploads(boolean keepUploads) {
            this.keepUploads = keepUploads;
        }

        public boolean isKeepScratch() {
            return keepScratch;
        }

        public void setKeepScratch(boolean keepScratch) {
            this.keepScratch = keepScratch;
        }
    }

    public static class Multipart {

        /**
         * Bytes a single part may buffer in memory before the reader spills it to a temporary file.
         */
        private DataSize maxInMemorySize = DataSize.ofMegabytes(64);

        public DataSize getMaxInMemorySize() {
            return maxInMemorySize;
        }

        public void setMaxInMemorySize(DataSize maxInMemorySize) {
            this.maxInMemorySize = maxInMemorySize;
        }
    }
}
