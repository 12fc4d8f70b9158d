package io.netwarden.supervisor;

import io.netwarden.util.Cancellation;
import org.slf4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

public final class Supervisor {
    private final Logger logger;
    private final Cancellation shutdown;
    private final Map<String, Worker> workers;
    private final Object stateLock;
    private final AtomicBoolean started;
    private final List<WorkerException> errors;

    public Supervisor(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.shutdown = new Cancellation();
        this.workers = new LinkedHashMap<>();
        this.stateLock = new Object();
        this.started = new AtomicBoolean(false);
        this.errors = new ArrayList<>();
        this.shutdown.onCancel(this::wakeWaiters);
    }

    public Logger logger() {
        return logger;
    }

    public WorkerHandle supervise(Worker worker) {
        Objects.requireNonNull(worker, "worker");
        synchronized (stateLock) {
            if (started.get()) {
                throw new SupervisorException("cannot register worker " + worker.name() + " after run() was called");
            }
            if (workers.containsKey(worker.name())) {
                throw new SupervisorException("duplicate worker name: " + worker.name());
            }
            workers.put(worker.name(), worker);
        }
        return new WorkerHandle(worker.name());
    }

    public void shutdown() {
        if (shutdown.cancel("shutdown requested")) {
            logger.info("supervisor: shutting down");
        }
    }

    private void wakeWaiters() {
        synchronized (stateLock) {
            stateLock.notifyAll();
        }
    }

    public Cancellation shutdownSignal() {
        return shutdown;
    }

    public List<WorkerException> run() {
        if (!started.compareAndSet(false, true)) {
            throw new SupervisorException("supervisor is already running");
        }
        Map<String, Node> graph = resolve();
        CountDownLatch finished = new CountDownLatch(graph.size());
        for (Node node : graph.values()) {
            Thread thread = new Thread(() -> {
                try {
                    runNode(node);
                } finally {
                    finished.countDown();
                }
            }, "netwarden-worker-" + node.worker.name());
            thread.start();
        }
        boolean interrupted = false;
        while (true) {
            try {
                finished.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
                shutdown();
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        synchronized (stateLock) {
            return List.copyOf(errors);
        }
    }

    private void runNode(Node node) {
        String name = node.worker.name();
        if (!awaitPrerequisites(node)) {
            markTerminated(node);
            return;
        }
        logger.info("supervisor: starting worker {}", name);
        WorkerProcess process = new WorkerProcess(this, name, () -> markReady(node));
        try {
            node.worker.work().run(process);
            logger.info("supervisor: worker {} exited", name);
        } catch (Throwable e) {
            WorkerException failure = new WorkerException(name, e);
            logger.error("supervisor: {}", failure.getMessage(), e);
            synchronized (stateLock) {
                errors.add(failure);
            }
            shutdown();
        } finally {
            markTerminated(node);
        }
    }

    private boolean awaitPrerequisites(Node node) {
        synchronized (stateLock) {
            while (true) {
                if (shutdown.isCancelled()) {
                    logger.info("supervisor: not starting worker {}: shutting down", node.worker.name());
                    return false;
                }
                boolean allReady = true;
                for (Node prerequisite : node.prerequisites) {
                    if (prerequisite.ready) {
                        continue;
                    }
                    if (prerequisite.terminated) {
                        logger.warn("supervisor: not starting worker {}: {} exited before it was ready",
                                node.worker.name(), prerequisite.worker.name());
                        return false;
                    }
                    allReady = false;
                }
                if (allReady) {
                    return true;
                }
                try {
                    stateLock.wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
    }

    private void markReady(Node node) {
        synchronized (stateLock) {
            if (node.ready) {
                return;
            }
            node.ready = true;
            stateLock.notifyAll();
        }
        logger.info("supervisor: worker {} is ready", node.worker.name());
    }

    private void markTerminated(Node node) {
        synchronized (stateLock) {
            node.terminated = true;
            stateLock.notifyAll();
        }
    }

    private Map<String, Node> resolve() {
        Map<String, Node> graph = new LinkedHashMap<>();
        synchronized (stateLock) {
            for (Worker worker : workers.values()) {
                graph.put(worker.name(), new Node(worker));
            }
        }
        for (Node node : graph.values()) {
            for (String required : node.worker.requires()) {
                Node prerequisite = graph.get(required);
                if (prerequisite == null) {
                    throw new SupervisorException(
                            "worker " + node.worker.name() + " requires unknown worker " + required);
                }
                node.prerequisites.add(prerequisite);
            }
        }
        rejectCycles(graph);
        return graph;
    }

    // Kahn's algorithm: anything left unsorted sits on a cycle.
    private static void rejectCycles(Map<String, Node> graph) {
        Map<Node, Integer> pending = new HashMap<>();
        Map<Node, List<Node>> dependents = new HashMap<>();
        Deque<Node> queue = new ArrayDeque<>();
        for (Node node : graph.values()) {
            pending.put(node, node.prerequisites.size());
            for (Node prerequisite : node.prerequisites) {
                dependents.computeIfAbsent(prerequisite, k -> new ArrayList<>()).add(node);
            }
            if (node.prerequisites.isEmpty()) {
                queue.add(node);
            }
        }
        int sorted = 0;
        while (!queue.isEmpty()) {
            Node node = queue.poll();
            sorted++;
            for (Node dependent : dependents.getOrDefault(node, List.of())) {
                int left = pending.merge(dependent, -1, Integer::sum);
                if (left == 0) {
                    queue.add(dependent);
                }
            }
        }
        if (sorted != graph.size()) {
            List<String> cyclic = new ArrayList<>();
            for (Map.Entry<Node, Integer> entry : pending.entrySet()) {
                if (entry.getValue() > 0) {
                    cyclic.add(entry.getKey().worker.name());
                }
            }
            cyclic.sort(String::compareTo);
            throw new SupervisorException("dependency cycle between workers " + cyclic);
        }
    }

    private static final class Node {
        private final Worker worker;
        private final List<Node> prerequisites = new ArrayList<>();
        private boolean ready;
        private boolean terminated;

        private Node(Worker worker) {
            this.worker = worker;
        }
    }
}
