package com.chicu.botjobs.web.controller.api;

import com.chicu.botjobs.common.enums.JobKind;
import com.chicu.botjobs.engine.TimerTable;
import com.chicu.botjobs.scheduler.OwnerZoneService;
import com.chicu.botjobs.scheduler.ReminderScheduler;
import com.chicu.botjobs.service.JobStore;
import com.chicu.botjobs.watch.WatchPollOutcome;
import com.chicu.botjobs.watch.WatchPoller;
import com.chicu.botjobs.watch.WatchQueueProcessor;
import com.chicu.botjobs.web.dto.ApiResponse;
import com.chicu.botjobs.web.dto.JobDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Служебный API для оператора бота: просмотр, чистка, ручной diff-опрос.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/jobs")
public class JobAdminApiController {

    private final JobStore jobStore;
    private final ReminderScheduler reminderScheduler;
    private final TimerTable timers;
    private final WatchPoller watchPoller;
    private final WatchQueueProcessor queueProcessor;
    private final OwnerZoneService zones;

    @GetMapping
    public List<JobDto> list(@RequestParam JobKind kind,
                             @RequestParam(required = false) String owner) {
        return jobStore.list(kind, owner).stream()
                .map(j -> JobDto.from(j, timers.isArmed(j.getId())))
                .toList();
    }

    @GetMapping("/{id}")
    public ResponseEntity<JobDto> get(@PathVariable String id) {
        return jobStore.get(id)
                .map(j -> ResponseEntity.ok(JobDto.from(j, timers.isArmed(id))))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Снять таймер и удалить запись.
     */
    @DeleteMapping("/{id}")
    public ApiResponse remove(@PathVariable String id) {
        reminderScheduler.cancel(id);
        int deleted = jobStore.remove(id);
        log.info("🗑 /api/jobs/{} removed={}", id, deleted);
        return ApiResponse.ok("removed", deleted);
    }

    @DeleteMapping
    public ApiResponse clear(@RequestParam JobKind kind,
                             @RequestParam(required = false) String owner) {
        int deleted = jobStore.clear(kind, owner);
        return ApiResponse.ok("cleared", deleted);
    }

    /**
     * Ручной diff-опрос по владельцу.
     */
    @PostMapping("/watch/poll")
    public List<WatchPollOutcome> poll(@RequestParam String owner) {
        log.info("🔎 /api/jobs/watch/poll owner={}", owner);
        return watchPoller.pollOwner(owner);
    }

    @PostMapping("/watch/queue/process")
    public ApiResponse processQueue() {
        int processed = queueProcessor.drainQueue();
        int named = queueProcessor.backfillNames();
        return ApiResponse.ok("processed queue, named " + named, processed);
    }

    @PostMapping("/reminders/reload")
    public ApiResponse reload() {
        return ApiResponse.ok("armed", reminderScheduler.loadAll());
    }

    /**
     * Живые таймеры: id → когда взведён.
     */
    @GetMapping("/timers")
    public Map<String, Instant> armedTimers() {
        Map<String, Instant> out = new TreeMap<>();
        for (String id : timers.armedIds()) {
            timers.getArmedAt(id).ifPresent(at -> out.put(id, at));
        }
        return out;
    }

    @PutMapping("/timezone/{owner}")
    public ApiResponse setZone(@PathVariable String owner,
                               @RequestParam String zone,
                               @RequestParam(required = false) String channelId) {
        zones.setOwnerZone(owner, channelId, zone);
        return ApiResponse.ok("zone " + zone, 1);
    }
}
