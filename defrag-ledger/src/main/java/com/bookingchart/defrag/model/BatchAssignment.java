package com.bookingchart.defrag.model;

import java.util.List;

public record BatchAssignment(MoveBatch batch, List<DefragMove> moves) {}
