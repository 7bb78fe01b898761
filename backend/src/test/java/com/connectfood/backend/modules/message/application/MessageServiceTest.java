package com.connectfood.backend.modules.message.application;

import static com.connectfood.backend.support.EntityFields.setField;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.UUID;

import com.connectfood.backend.modules.message.domain.Message;
import com.connectfood.backend.modules.message.infrastructure.persistence.MessageRepository;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

@ExtendWith(MockitoExtension.class)
class MessageServiceTest {

    @Mock
    private MessageRepository messageRepository;

    @Test
    void storesMessageForMatch() {
        MessageService service = new MessageService(messageRepository);
        UUID matchId = UUID.randomUUID();
        UUID senderId = UUID.randomUUID();
        when(messageRepository.save(any(Message.class)))
                .thenAnswer(invocation -> setField(invocation.getArgument(0), "id", UUID.randomUUID()));

        Message saved = service.sendMessage(matchId, senderId, "Pickup at 6pm?");

        ArgumentCaptor<Message> captor = ArgumentCaptor.forClass(Message.class);
        verify(messageRepository).save(captor.capture());
        assertThat(captor.getValue().getMatchId()).isEqualTo(matchId);
        assertThat(captor.getValue().getSenderId()).isEqualTo(senderId);
        assertThat(captor.getValue().getContent()).isEqualTo("Pickup at 6pm?");
        assertThat(saved.getId()).isNotNull();
    }

    @Test
    void threadIsReadOldestFirstAndCapped() {
        MessageService service = new MessageService(messageRepository);
        UUID matchId = UUID.randomUUID();
        Message first = new Message();
        first.setContent("hello");
        when(messageRepository.findByMatchIdOrderByCreatedAtAsc(matchId, PageRequest.of(0, MessageService.MAX_THREAD_SIZE)))
                .thenReturn(List.of(first));

        assertThat(service.getThread(matchId)).containsExactly(first);
        assertThat(MessageService.MAX_THREAD_SIZE).isEqualTo(200);
    }
}
