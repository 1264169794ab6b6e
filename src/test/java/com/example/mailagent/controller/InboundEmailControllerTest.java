package com.example.mailagent.controller;

import com.example.mailagent.integration.EmailItem;
import com.example.mailagent.workflow.WorkflowDispatcher;
import com.example.mailagent.workflow.WorkflowEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(InboundEmailController.class)
@AutoConfigureMockMvc
class InboundEmailControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private WorkflowEngine workflowEngine;

    @MockBean
    private WorkflowDispatcher workflowDispatcher;

    private InboundEmailRequest request() {
        InboundEmailRequest request = new InboundEmailRequest();
        request.setUserId("user-1");
        request.setMessageId("msg-1");
        request.setThreadId("thread-1");
        request.setRfcMessageId("<msg-1@mail.example>");
        request.setSender("anna@example.com");
        request.setSubject("Tax return deadline");
        request.setBody("Please submit your documents.");
        return request;
    }

    @Test
    void testReceive_Accepted() throws Exception {
        when(workflowEngine.start(any(EmailItem.class))).thenReturn("wf-1");
        when(workflowDispatcher.dispatch("wf-1")).thenReturn(true);

        mockMvc.perform(post("/api/v1/emails")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request())))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.instanceId", is("wf-1")))
                .andExpect(jsonPath("$.status", is("accepted")));

        ArgumentCaptor<EmailItem> captor = ArgumentCaptor.forClass(EmailItem.class);
        verify(workflowEngine, times(1)).start(captor.capture());
        assertEquals("msg-1", captor.getValue().messageId());
        assertEquals("<msg-1@mail.example>", captor.getValue().rfcMessageId());
        assertNotNull(captor.getValue().receivedAt());
        verify(workflowDispatcher, times(1)).dispatch("wf-1");
    }

    @Test
    void testReceive_DeferredWhenPoolIsFull() throws Exception {
        when(workflowEngine.start(any(EmailItem.class))).thenReturn("wf-1");
        when(workflowDispatcher.dispatch("wf-1")).thenReturn(false);

        mockMvc.perform(post("/api/v1/emails")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request())))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status", is("deferred")));
    }

    @Test
    void testReceive_MissingMessageId() throws Exception {
        InboundEmailRequest request = request();
        request.setMessageId(" ");

        mockMvc.perform(post("/api/v1/emails")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("userId and messageId are required")));

        verifyNoInteractions(workflowEngine, workflowDispatcher);
    }
}
