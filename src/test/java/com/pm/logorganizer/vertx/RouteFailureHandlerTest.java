package com.pm.logorganizer.vertx;

import io.vertx.core.http.HttpClosedException;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
public class RouteFailureHandlerTest {
    @Mock
    private RoutingContext routingContext;
    @Mock
    private HttpServerResponse response;

    private RouteFailureHandler handler;

    @BeforeEach
    public void setup() {
        handler = new RouteFailureHandler();
        when(routingContext.response()).thenReturn(response);
        when(routingContext.normalizedPath()).thenReturn("/logorganizer/batch");
        when(response.ended()).thenReturn(false);
        when(response.closed()).thenReturn(false);
        when(response.setStatusCode(anyInt())).thenReturn(response);
        when(response.putHeader(any(CharSequence.class), any(CharSequence.class))).thenReturn(response);
    }

    @Test
    public void testUnhandledException_returns500() {
        when(routingContext.statusCode()).thenReturn(-1);
        when(routingContext.failure()).thenReturn(new RuntimeException("boom"));

        handler.handle(routingContext);

        ArgumentCaptor<String> bodyCaptor = ArgumentCaptor.forClass(String.class);
        verify(response).setStatusCode(500);
        verify(response).end(bodyCaptor.capture());
        JsonObject body = new JsonObject(bodyCaptor.getValue());
        assertEquals("failed", body.getString("status"));
        assertEquals("Internal Server Error", body.getString("reason"));
    }

    @Test
    public void testClientError_keepsStatusCode() {
        when(routingContext.statusCode()).thenReturn(413);
        when(routingContext.failure()).thenReturn(null);

        handler.handle(routingContext);

        ArgumentCaptor<String> bodyCaptor = ArgumentCaptor.forClass(String.class);
        verify(response).setStatusCode(413);
        verify(response).end(bodyCaptor.capture());
        assertEquals("bad_request", new JsonObject(bodyCaptor.getValue()).getString("status"));
    }

    @Test
    public void testHttpClosedException_endsWithoutStatus() {
        when(routingContext.statusCode()).thenReturn(-1);
        when(routingContext.failure()).thenReturn(new HttpClosedException("closed"));

        handler.handle(routingContext);

        verify(response, never()).setStatusCode(anyInt());
        verify(response).end();
    }

    @Test
    public void testResponseAlreadyEnded_nothingWritten() {
        when(routingContext.statusCode()).thenReturn(500);
        when(routingContext.failure()).thenReturn(new RuntimeException("late failure"));
        when(response.ended()).thenReturn(true);

        handler.handle(routingContext);

        verify(response, never()).setStatusCode(anyInt());
        verify(response, never()).end(anyString());
    }
}
