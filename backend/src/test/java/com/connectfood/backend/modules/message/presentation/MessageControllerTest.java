package com.connectfood.backend.modules.message.presentation;

import static com.connectfood.backend.support.EntityFields.setField;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.UUID;

import com.connectfood.backend.modules.message.application.MessageService;
import com.connectfood.backend.modules.message.domain.Message;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = MessageController.class)
class MessageControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MessageService messageService;

    @Test
    void threadIsListedForMatch() throws Exception {
        UUID matchId = UUID.randomUUID();
        Message message = new Message();
        message.setMatchId(matchId);
        message.setSenderId(UUID.randomUUID());
        message.setContent("Pickup at 6pm?");
        when(messageService.getThread(matchId)).thenReturn(List.of(message));

        mockMvc.perform(get("/api/messages").param("match_id", matchId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].content").value("Pickup at 6pm?"))
                .andExpect(jsonPath("$.items[0].match_id").value(matchId.toString()));
    }

    @Test
    void matchIdThatIsNotUuidHasNoMessages() throws Exception {
        mockMvc.perform(get("/api/messages").param("match_id", "not-a-match"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items").isEmpty());

        verify(messageService, never()).getThread(any());
    }

    @Test
    void sendReturnsStoredId() throws Exception {
        UUID id = UUID.randomUUID();
        when(messageService.sendMessage(any(), any(), any()))
                .thenReturn(setField(new Message(), "id", id));

        mockMvc.perform(post("/api/message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"match_id": "%s", "sender_id": "%s", "content": "On my way"}
                                """.formatted(UUID.randomUUID(), UUID.randomUUID())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(id.toString()));
    }
}
