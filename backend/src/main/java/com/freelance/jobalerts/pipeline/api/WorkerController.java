package com.freelance.jobalerts.pipeline.api;

import com.freelance.jobalerts.pipeline.model.CycleStats;
import com.freelance.jobalerts.pipeline.model.WorkerStatusResponse;
import com.freelance.jobalerts.pipeline.service.AlertWorkerDaemon;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/worker")
public class WorkerController {
    private final AlertWorkerDaemon workerDaemon;

    public WorkerController(AlertWorkerDaemon workerDaemon) {
        this.workerDaemon = workerDaemon;
    }

    @GetMapping("/status")
    public WorkerStatusResponse status() {
        return workerDaemon.getStatus();
    }

    @PostMapping("/start")
    public WorkerStatusResponse start() {
        workerDaemon.start();
        return workerDaemon.getStatus();
    }

    @PostMapping("/stop")
    public WorkerStatusResponse stop() {
        workerDaemon.stop();
        return workerDaemon.getStatus();
    }

    @PostMapping("/run")
    public CycleStats run() {
        return workerDaemon.runOnce();
    }
}
