package com.quick.trio.trio;

public record ApiError(int status, String message) {
}
