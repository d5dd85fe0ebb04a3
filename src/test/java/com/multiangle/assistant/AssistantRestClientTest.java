package com.multiangle.assistant;

import com.multiangle.exception.AssistantServiceException;
import com.multiangle.orchestration.model.AssistantMessage;
import com.multiangle.orchestration.model.ConversationHandle;
import com.multiangle.orchestration.model.MessageState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class AssistantRestClientTest {

    private static final String BASE_URL = "http://assistant.test";

    private MockRestServiceServer server;
    private AssistantRestClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder()
                .baseUrl(BASE_URL)
                .defaultHeader("x-api-key", "secret");
        server = MockRestServiceServer.bindTo(builder).build();
        client = new AssistantRestClient(builder.build());
    }

    @Test
    void testCreateConversation() {
        server.expect(requestTo(BASE_URL + "/assistant/conversations"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("x-api-key", "secret"))
                .andExpect(content().json("{\"message\":\"What drives adoption?\"}"))
                .andRespond(withSuccess("{\"conversationId\":\"c-1\",\"messageId\":\"m-1\",\"extra\":true}",
                        MediaType.APPLICATION_JSON));

        ConversationHandle handle = client.createConversation("What drives adoption?");

        assertEquals(new ConversationHandle("c-1", "m-1"), handle);
        server.verify();
    }

    @Test
    void testGetMessageMapsStateContentAndSources() {
        server.expect(requestTo(BASE_URL + "/assistant/conversations/c-1/messages/m-1"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        {
                          "id": "m-1",
                          "state": "COMPLETED",
                          "content": "Answer text",
                          "timestamp": "2024-05-01T10:00:00Z",
                          "metadata": {"model": "x"},
                          "sources": [
                            {"sourceId": "S1", "title": "Report", "url": "https://s1", "pageNumber": 4, "score": 0.9}
                          ]
                        }
                        """, MediaType.APPLICATION_JSON));

        AssistantMessage message = client.getMessage("c-1", "m-1");

        assertEquals("m-1", message.messageId());
        assertEquals(MessageState.COMPLETED, message.state());
        assertEquals("Answer text", message.content());
        assertEquals("S1", message.sources().get(0).sourceId());
        assertEquals(4, message.sources().get(0).pageNumber());
        assertEquals("x", message.metadata().get("model"));
        server.verify();
    }

    @Test
    void testGetMessageWithUnrecognisedStatus() {
        server.expect(requestTo(BASE_URL + "/assistant/conversations/c-1/messages/m-1"))
                .andRespond(withSuccess("{\"status\":\"thinking\"}", MediaType.APPLICATION_JSON));

        AssistantMessage message = client.getMessage("c-1", "m-1");

        assertEquals(MessageState.UNKNOWN, message.state());
        assertEquals("thinking", message.status());
    }

    @Test
    void testSendFollowupAndFeedback() {
        server.expect(requestTo(BASE_URL + "/assistant/conversations/c-1/messages"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"message\":\"And costs?\"}"))
                .andRespond(withSuccess("{\"messageId\":\"m-2\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE_URL + "/assistant/messages/m-2/feedback"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"feedback\":\"success\"}"))
                .andRespond(withSuccess("{\"received\":true}", MediaType.APPLICATION_JSON));

        ConversationHandle followup = client.sendFollowup("c-1", "And costs?");
        Map<String, Object> ack = client.giveFeedback("m-2", "success");

        assertEquals("m-2", followup.messageId());
        assertNull(followup.conversationId());
        assertEquals(Boolean.TRUE, ack.get("received"));
        server.verify();
    }

    @Test
    void testNon2xxBecomesAssistantServiceException() {
        server.expect(requestTo(BASE_URL + "/assistant/conversations"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED).body("{\"detail\":\"bad key\"}")
                        .contentType(MediaType.APPLICATION_JSON));

        AssistantServiceException ex = assertThrows(AssistantServiceException.class,
                () -> client.createConversation("q"));

        assertEquals(401, ex.getStatusCode());
        assertEquals("create-conversation", ex.getOperation());
    }
}
