package com.quick.trio.trio;

import lombok.RequiredArgsConstructor;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

@Component
@RequiredArgsConstructor
public class SessionDisconnectListener {

    private final RoomManager roomManager;

    @EventListener
    public void onDisconnect(SessionDisconnectEvent event) {
        roomManager.leave(event.getSessionId());
    }
}
