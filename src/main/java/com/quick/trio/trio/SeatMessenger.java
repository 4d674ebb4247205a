package com.quick.trio.trio;

import lombok.RequiredArgsConstructor;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Pushes events to a single STOMP session on {@value #DESTINATION}.
 */
@Component
@RequiredArgsConstructor
public class SeatMessenger {

    public static final String DESTINATION = "/queue/trio";

    private final SimpMessagingTemplate messagingTemplate;

    /**
     * @throws MessagingException when the session can no longer be reached
     */
    public void send(String sessionId, TrioEvent event) {
        SimpMessageHeaderAccessor headers = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        headers.setSessionId(sessionId);
        headers.setLeaveMutable(true);
        messagingTemplate.convertAndSendToUser(sessionId, DESTINATION, event, headers.getMessageHeaders());
    }
}
