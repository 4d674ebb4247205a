package com.quick.trio.trio;

import lombok.RequiredArgsConstructor;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

@Controller
@RequiredArgsConstructor
public class TrioWebSocketController {

    private final RoomManager roomManager;

    /**
     * Client sends JoinMessage to /app/trio/{roomCode}/join
     */
    @MessageMapping("/trio/{roomCode}/join")
    public void join(@DestinationVariable String roomCode,
                     @Payload JoinMessage message,
                     @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        roomManager.join(sessionId, roomCode, message.getName());
    }

    /**
     * Client sends ActionMessage to /app/trio/{roomCode}/action
     */
    @MessageMapping("/trio/{roomCode}/action")
    public void action(@DestinationVariable String roomCode,
                       @Payload ActionMessage message,
                       @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        roomManager.dispatch(sessionId, roomCode, message);
    }
}
