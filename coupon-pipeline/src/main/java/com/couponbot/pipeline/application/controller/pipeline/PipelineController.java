package com.couponbot.pipeline.application.controller.pipeline;

import com.couponbot.pipeline.application.job.CouponScheduler;
import com.couponbot.pipeline.application.job.SchedulerStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/pipeline")
@RequiredArgsConstructor
public class PipelineController {

    private final CouponScheduler couponScheduler;

    @PostMapping("/runs")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void triggerRun() {
        couponScheduler.triggerNow();
    }

    @GetMapping("/status")
    public SchedulerStatus status() {
        return couponScheduler.status();
    }
}
