package com.power.anomaly.model;

import java.util.List;

public record ParseResult(List<PowerRecord> records, int rowsParsed, int rowsDropped) {}
