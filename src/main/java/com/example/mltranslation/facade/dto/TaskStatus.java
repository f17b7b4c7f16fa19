package com.example.mltranslation.facade.dto;



/**
 * 非同步翻譯任務狀態
 */
public enum TaskStatus {
    /**
     * 已發布至佇列
     */
    QUEUED,

    /**
     * 尚無翻譯紀錄（排隊中、處理中或已進入死信）
     */
    PENDING,

    /**
     * 已完成，翻譯紀錄可查詢
     */
    DONE
}
