package com.quick.trio.trio;

public record FinalScore(String name, int trios) {
}
