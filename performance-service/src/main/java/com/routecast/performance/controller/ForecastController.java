package com.routecast.performance.controller;

import com.routecast.common.emission.EmissionBatch;
import com.routecast.performance.dto.ForecastRequestDTO;
import com.routecast.performance.service.ForecastService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/forecasts")
public class ForecastController {

    private static final Logger log = LoggerFactory.getLogger(ForecastController.class);

    private final ForecastService forecastService;

    public ForecastController(ForecastService forecastService) {
        this.forecastService = forecastService;
    }

    @PostMapping
    public Mono<ResponseEntity<EmissionBatch>> emit(@RequestBody ForecastRequestDTO request) {
        log.info("Forecast emission requested. target={}-W{} weeksAhead={}",
                 request.year(), request.week(), request.weeksAhead());
        return forecastService.emit(request)
            .map(ResponseEntity::ok);
    }
}
