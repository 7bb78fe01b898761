package com.connectfood.backend.modules.message.application;

import java.util.List;
import java.util.UUID;

import com.connectfood.backend.modules.message.domain.Message;
import com.connectfood.backend.modules.message.infrastructure.persistence.MessageRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class MessageService {

    private static final Logger log = LoggerFactory.getLogger(MessageService.class);
    static final int MAX_THREAD_SIZE = 200;

    private final MessageRepository messageRepository;

    public MessageService(MessageRepository messageRepository) {
        this.messageRepository = messageRepository;
    }

    public Message sendMessage(UUID matchId, UUID senderId, String content) {
        Message message = new Message();
        message.setMatchId(matchId);
        message.setSenderId(senderId);
        message.setContent(content);
        Message saved = messageRepository.save(message);
        log.debug("Message {} stored for match {}", saved.getId(), matchId);
        return saved;
    }

    /**
     * Oldest first, at most {@value #MAX_THREAD_SIZE} messages.
     */
    @Transactional(readOnly = true)
    public List<Message> getThread(UUID matchId) {
        return messageRepository.findByMatchIdOrderByCreatedAtAsc(matchId, PageRequest.of(0, MAX_THREAD_SIZE));
    }
}
