package com.quick.trio.trio;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/rooms")
@RequiredArgsConstructor
@CrossOrigin("*")
public class RoomController {

    private final RoomManager roomManager;
    private final GameArchiveService archiveService;

    @PostMapping
    public ResponseEntity<RoomView> createRoom(@RequestBody(required = false) CreateRoomRequest request) {
        CreateRoomRequest body = request == null ? new CreateRoomRequest() : request;
        Room room = roomManager.createRoom(body.getName(), body.getMode());
        return ResponseEntity.ok(RoomView.from(room));
    }

    @GetMapping
    public List<RoomView> listRooms() {
        return roomManager.listOpenRooms().stream().map(RoomView::from).toList();
    }

    @GetMapping("/finished")
    public List<FinishedGame> finishedGames() {
        return archiveService.recent();
    }

    @GetMapping("/{roomCode}")
    public RoomView getRoom(@PathVariable String roomCode) {
        return roomManager.findRoom(roomCode)
                .map(RoomView::from)
                .orElseThrow(() -> new RoomNotFoundException(roomCode));
    }
}
