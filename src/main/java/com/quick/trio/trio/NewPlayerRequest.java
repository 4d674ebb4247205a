package com.quick.trio.trio;

import lombok.Data;

@Data
public class NewPlayerRequest {
    private String name;
}
