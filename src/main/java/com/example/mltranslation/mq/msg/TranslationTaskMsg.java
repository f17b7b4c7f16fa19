package com.example.mltranslation.mq.msg;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 翻譯任務訊息
 *
 * Topic: translation-tasks
 * 消息流向：API（TranslationFacade.submitTask）→ Translation Worker
 *
 * 同時接受 snake_case 欄位名稱（user_id、input_text ...），供外部發布者使用。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranslationTaskMsg implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * 任務 ID（correlation id）
     * 用於冪等性控制，對應 Translation.externalId
     */
    @JsonAlias({"correlation_id", "task_id"})
    private String taskId;

    @JsonAlias("user_id")
    private Long userId;

    @JsonAlias({"input_text", "text"})
    private String inputText;

    @JsonAlias("source_lang")
    private String sourceLang;

    @JsonAlias("target_lang")
    private String targetLang;

    /**
     * 發布時間（Unix epoch milliseconds）
     */
    private long timestamp;
}
