package com.energyweather.recon.model;

/**
 * A raw file that was skipped. Rejections never stop a run.
 */
public final class FileRejection {
    public final String fileName;
    public final Reason reason;
    public final String detail;

    public FileRejection(String fileName, Reason reason, String detail) {
        this.fileName = fileName == null ? "" : fileName;
        this.reason = reason;
        this.detail = detail == null ? "" : detail;
    }

    @Override
    public String toString() {
        return fileName + " -> " + reason.code() + (detail.isEmpty() ? "" : " (" + detail + ")");
    }

    public enum Reason {
        UNPARSEABLE_FILENAME("unparseable-filename"),
        UNRECOGNIZED_STRUCTURE("unrecognized-structure"),
        NO_USABLE_DATE("no-usable-date"),
        UNSUPPORTED_TYPE("unsupported-type"),
        UNREADABLE_FILE("unreadable-file");

        private final String code;

        Reason(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }
}
