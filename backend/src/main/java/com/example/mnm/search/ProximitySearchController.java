package com.example.mnm.search;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class ProximitySearchController {

    @GetMapping({"/professionals/search", "/api/professionals/search"})
    public ResponseEntity<Map<String, Object>> search(@RequestParam(required = false) String lat,
                                                      @RequestParam(required = false) String lon,
                                                      @RequestParam(required = false) String radius,
                                                      @RequestParam(required = false) String serviceId,
                                                      @RequestParam(name = "servico_id", required = false) String servicoId) {
        ProximitySearchQuery query = ProximitySearchQuery.parse(lat, lon, radius,
                serviceId != null ? serviceId : servicoId);

        // LinkedHashMap: a null serviceId is echoed back
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("lat", query.lat());
        params.put("lon", query.lon());
        params.put("radius", query.radius());
        params.put("serviceId", query.serviceId());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Proximity search available");
        body.put("params", params);
        body.put("note", "Distance is computed by the client (Haversine)");
        return ResponseEntity.ok(body);
    }
}
