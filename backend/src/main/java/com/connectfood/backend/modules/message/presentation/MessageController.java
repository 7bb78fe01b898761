package com.connectfood.backend.modules.message.presentation;

import java.util.List;

import com.connectfood.backend.global.common.Uuids;
import com.connectfood.backend.modules.message.application.MessageService;
import com.connectfood.backend.modules.message.domain.Message;
import com.connectfood.backend.modules.message.presentation.dto.MessageItemResponse;
import com.connectfood.backend.modules.message.presentation.dto.MessageListResponse;
import com.connectfood.backend.modules.message.presentation.dto.SendMessageRequest;
import com.connectfood.backend.modules.message.presentation.dto.SendMessageResponse;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class MessageController {

    private final MessageService messageService;

    public MessageController(MessageService messageService) {
        this.messageService = messageService;
    }

    @PostMapping("/message")
    public ResponseEntity<SendMessageResponse> sendMessage(@Valid @RequestBody SendMessageRequest request) {
        Message message = messageService.sendMessage(request.matchId(), request.senderId(), request.content());
        return ResponseEntity.ok(new SendMessageResponse(message.getId()));
    }

    @GetMapping("/messages")
    public ResponseEntity<MessageListResponse> getMessages(@RequestParam(name = "match_id") String matchId) {
        List<Message> thread = Uuids.tryParse(matchId)
                .map(messageService::getThread)
                .orElse(List.of());
        return ResponseEntity.ok(new MessageListResponse(
                thread.stream()
                        .map(this::toItemResponse)
                        .toList()
        ));
    }

    private MessageItemResponse toItemResponse(Message message) {
        return new MessageItemResponse(
                message.getId(),
                message.getMatchId(),
                message.getSenderId(),
                message.getContent(),
                message.getCreatedAt()
        );
    }
}
