package com.example.mnm;

import com.example.mnm.access.ResourceCollection;
import com.example.mnm.record.RecordTimestamps;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    static final String API_NAME = "Mao na Massa API";

    private final RecordTimestamps timestamps;

    public HealthController(RecordTimestamps timestamps) {
        this.timestamps = timestamps;
    }

    @GetMapping({"/health", "/api/health"})
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "OK");
        body.put("api", API_NAME);
        body.put("timestamp", timestamps.format(timestamps.now()));
        body.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime() / 1000);
        body.put("collections", ResourceCollection.paths());
        return body;
    }
}
