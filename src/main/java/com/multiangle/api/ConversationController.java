package com.multiangle.api;

import com.multiangle.orchestration.model.AssistantMessage;
import com.multiangle.orchestration.service.ConversationService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api")
public class ConversationController {

    private final ConversationService conversationService;

    public ConversationController(ConversationService conversationService) {
        this.conversationService = conversationService;
    }

    @PostMapping("/conversations/{conversationId}/followup")
    public AssistantMessage followUp(@PathVariable String conversationId, @Valid @RequestBody FollowupRequest request) {
        return conversationService.followUp(conversationId, request.message());
    }

    @PostMapping("/messages/{messageId}/feedback")
    public Map<String, Object> feedback(@PathVariable String messageId,
                                        @RequestBody(required = false) FeedbackRequest request) {
        return conversationService.giveFeedback(messageId, request != null ? request.feedback() : null);
    }
}
