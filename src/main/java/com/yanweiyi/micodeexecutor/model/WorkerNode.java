package com.yanweiyi.micodeexecutor.model;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Master 端登记的工作节点
 * <p>
 * 每个已分配未结束的任务占用一个槽位，槽位计数通过 CAS 修改。
 *
 * @author yanweiyi
 */
public class WorkerNode {

    @Getter
    private final String id;

    @Getter
    private final String address;

    @Getter
    private final int capacity;

    @Getter
    private final Instant registeredAt;

    private final AtomicInteger availableSlots;

    /**
     * 已分配、等待节点拉取的任务 id
     */
    private final Queue<String> outbox = new ConcurrentLinkedQueue<>();

    private volatile Instant lastHeartbeat;

    private volatile int activeTasks;

    public WorkerNode(String id, String address, int capacity, Instant now) {
        this.id = id;
        this.address = address;
        this.capacity = capacity;
        this.registeredAt = now;
        this.lastHeartbeat = now;
        this.availableSlots = new AtomicInteger(capacity);
    }

    public int getAvailableSlots() {
        return availableSlots.get();
    }

    /**
     * 占用一个槽位，没有空闲槽位时返回 false
     */
    public boolean tryAcquireSlot() {
        while (true) {
            int current = availableSlots.get();
            if (current <= 0) {
                return false;
            }
            if (availableSlots.compareAndSet(current, current - 1)) {
                return true;
            }
        }
    }

    public void releaseSlot() {
        while (true) {
            int current = availableSlots.get();
            if (current >= capacity) {
                return;
            }
            if (availableSlots.compareAndSet(current, current + 1)) {
                return;
            }
        }
    }

    public void offer(String jobId) {
        outbox.offer(jobId);
    }

    public List<String> drainOutbox() {
        List<String> jobIds = new ArrayList<>();
        String jobId;
        while ((jobId = outbox.poll()) != null) {
            jobIds.add(jobId);
        }
        return jobIds;
    }

    public Instant getLastHeartbeat() {
        return lastHeartbeat;
    }

    public int getActiveTasks() {
        return activeTasks;
    }

    public void heartbeat(int activeTasks, Instant now) {
        this.activeTasks = activeTasks;
        this.lastHeartbeat = now;
    }

    public WorkerView toView() {
        WorkerView view = new WorkerView();
        view.setId(id);
        view.setAddress(address);
        view.setCapacity(capacity);
        view.setAvailableSlots(availableSlots.get());
        view.setActiveTasks(activeTasks);
        view.setLastHeartbeat(lastHeartbeat);
        return view;
    }
}
