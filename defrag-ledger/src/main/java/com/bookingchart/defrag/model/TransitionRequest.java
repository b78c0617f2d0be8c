package com.bookingchart.defrag.model;

public record TransitionRequest(MoveAction action, String actor) {
}
