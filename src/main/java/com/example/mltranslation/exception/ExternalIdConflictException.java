package com.example.mltranslation.exception;

/**
 * external_id 已被其他使用者的翻譯紀錄佔用
 */
public class ExternalIdConflictException extends BusinessRuleException {

    private final String externalId;

    public ExternalIdConflictException(String externalId) {
        super(String.format("External id already used by another request: %s", externalId));
        this.externalId = externalId;
    }

    public String getExternalId() {
        return externalId;
    }
}
