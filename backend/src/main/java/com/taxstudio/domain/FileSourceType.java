package com.taxstudio.domain;

/**
 * How a receipt file entered the system.
 */
public enum FileSourceType {
    UPLOAD,
    MAIL_ATTACHMENT,
    /** Invoice rendered from the body of an email (no attachment). */
    MAIL_INVOICE_BODY,
    BANK_STORE;

    public boolean isMailDerived() {
        return this == MAIL_ATTACHMENT || this == MAIL_INVOICE_BODY;
    }
}
