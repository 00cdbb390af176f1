package com.yanweiyi.micodeexecutor.service;

import com.yanweiyi.micodeexecutor.model.WorkerNode;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 在线工作节点表，节点可随时加入或被剔除
 *
 * @author yanweiyi
 */
@Component
@ConditionalOnProperty(prefix = "micode.master", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WorkerRegistry {

    /**
     * 空闲槽位多的优先，其次按 id 排序
     */
    private static final Comparator<WorkerNode> ASSIGNMENT_ORDER = Comparator
            .comparingInt(WorkerNode::getAvailableSlots).reversed()
            .thenComparing(WorkerNode::getId);

    private final Map<String, WorkerNode> workers = new ConcurrentHashMap<>();

    public void register(WorkerNode worker) {
        workers.put(worker.getId(), worker);
    }

    public Optional<WorkerNode> findById(String workerId) {
        if (workerId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(workers.get(workerId));
    }

    public Optional<WorkerNode> remove(String workerId) {
        return Optional.ofNullable(workers.remove(workerId));
    }

    /**
     * 仅当登记的仍是同一个节点对象时删除
     */
    public boolean remove(WorkerNode worker) {
        return workers.remove(worker.getId(), worker);
    }

    public List<WorkerNode> snapshot() {
        List<WorkerNode> snapshot = new ArrayList<>(workers.values());
        snapshot.sort(Comparator.comparing(WorkerNode::getId));
        return snapshot;
    }

    /**
     * 选出有空闲槽位且空闲槽位最多的节点
     */
    public Optional<WorkerNode> selectForAssignment() {
        return workers.values().stream()
                .filter(worker -> worker.getAvailableSlots() > 0)
                .min(ASSIGNMENT_ORDER);
    }
}
