package com.example.mltranslation.controller;

import com.example.mltranslation.facade.TranslationFacade;
import com.example.mltranslation.facade.dto.TaskStatusResponse;
import com.example.mltranslation.facade.dto.TaskSubmissionResponse;
import com.example.mltranslation.facade.dto.TranslateRequest;
import com.example.mltranslation.facade.dto.TranslateResponse;
import com.example.mltranslation.security.AuthenticatedUser;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Slf4j
@Validated
@RestController
@RequestMapping("/translate")
@RequiredArgsConstructor
public class TranslationController {

    private final TranslationFacade translationFacade;

    @PostMapping
    public ResponseEntity<TranslateResponse> translate(@AuthenticationPrincipal AuthenticatedUser user,
                                                       @Valid @RequestBody TranslateRequest request) {
        log.info("POST /translate - userId={}, {} -> {}", user.getId(), request.getSourceLang(), request.getTargetLang());

        return ResponseEntity.ok(translationFacade.translate(user.getId(), request));
    }

    @PostMapping("/tasks")
    public ResponseEntity<TaskSubmissionResponse> submitTask(@AuthenticationPrincipal AuthenticatedUser user,
                                                             @Valid @RequestBody TranslateRequest request) {
        log.info("POST /translate/tasks - userId={}, {} -> {}", user.getId(), request.getSourceLang(), request.getTargetLang());

        TaskSubmissionResponse response = translationFacade.submitTask(user.getId(), request);

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @GetMapping("/tasks/{taskId}")
    public ResponseEntity<TaskStatusResponse> getTaskStatus(
            @AuthenticationPrincipal AuthenticatedUser user,
            @PathVariable
            @NotBlank(message = "TaskId cannot be null or blank")
            @Size(max = 64, message = "TaskId must be at most 64 characters")
            String taskId) {
        log.info("GET /translate/tasks/{} - userId={}", taskId, user.getId());

        return ResponseEntity.ok(translationFacade.getTaskStatus(user.getId(), taskId));
    }
}
