package com.di.logsift.store;

import java.util.Map;

public record ScanHit(String id, Map<String, Object> source) {
}
