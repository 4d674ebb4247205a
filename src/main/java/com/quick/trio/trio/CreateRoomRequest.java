package com.quick.trio.trio;

import lombok.Data;

@Data
public class CreateRoomRequest {
    private String name;
    private String mode;
}
