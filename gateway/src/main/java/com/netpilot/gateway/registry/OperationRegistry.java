package com.netpilot.gateway.registry;

import com.netpilot.gateway.operation.MutatingOperation;
import com.netpilot.gateway.operation.Operation;
import com.netpilot.gateway.operation.OperationDescriptor;
import com.netpilot.gateway.operation.OperationException;
import com.netpilot.gateway.operation.UnknownOperationException;
import com.netpilot.gateway.permission.PermissionGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process catalog of operations and their callable/denied status.
 *
 * <p>Two ways in:
 * <ol>
 *   <li>{@link #register(Operation)} - eager. The handler is resident and
 *       the permission gate is consulted immediately; the status is fixed for
 *       the life of the process.</li>
 *   <li>{@link #registerDeferred(OperationDescriptor, boolean)} - lazy. Only
 *       the descriptor is known. The first {@link #resolveForExecution} loads
 *       the handler through the {@link OperationLoader}; concurrent first
 *       callers wait on the same in-flight load. The gate is then consulted
 *       once and the status fixed. A failed load denies the operation for the
 *       rest of the run and is never retried.</li>
 * </ol>
 *
 * Denied operations stay visible in {@link #snapshot()}.
 *
 * <p>Instances are built once at startup by {@link RegistryBootstrap} and
 * shared by reference; there is no global registry.
 */
public class OperationRegistry {

    private static final Logger log = LoggerFactory.getLogger(OperationRegistry.class);

    private final Map<String, Slot> slots = new ConcurrentHashMap<>();
    private final PermissionGate    gate;
    private final OperationLoader   loader;

    public OperationRegistry(PermissionGate gate, OperationLoader loader) {
        this.gate   = gate;
        this.loader = loader;
    }

    // ------------------------------------------------------------------
    // Registration
    // ------------------------------------------------------------------

    /**
     * Register a live handler (eager mode).
     *
     * @throws IllegalStateException    if the name is already registered
     * @throws IllegalArgumentException if a mutating handler has no preview path
     */
    public RegistryEntry register(Operation handler) {
        OperationDescriptor descriptor = handler.descriptor();
        String problem = previewPathProblem(descriptor, handler);
        if (problem != null) {
            throw new IllegalArgumentException(problem);
        }
        Slot slot = new Slot(descriptor, evaluate(descriptor));
        slot.load.set(CompletableFuture.completedFuture(handler));
        insert(slot);
        log.info("Registered operation '{}' [{}/{}] -> {}",
                descriptor.name(), descriptor.category().key(), descriptor.action().key(), slot.status);
        return slot.entry();
    }

    /**
     * Register a descriptor whose handler is loaded on first execution (lazy mode).
     *
     * @param precheck evaluate the permission gate now instead of on first dispatch;
     *                 a pre-denied operation is then never loaded at all
     * @throws IllegalStateException if the name is already registered
     */
    public RegistryEntry registerDeferred(OperationDescriptor descriptor, boolean precheck) {
        Slot slot = new Slot(descriptor, precheck ? evaluate(descriptor) : RegistrationStatus.UNRESOLVED);
        insert(slot);
        log.debug("Registered deferred operation '{}' [{}/{}] -> {}",
                descriptor.name(), descriptor.category().key(), descriptor.action().key(), slot.status);
        return slot.entry();
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    /**
     * Current entry for a name, without loading anything.
     *
     * @throws UnknownOperationException if no such operation is registered
     */
    public RegistryEntry resolve(String name) {
        return slot(name).entry();
    }

    /**
     * Resolve an operation for execution: load the handler if it is not yet
     * resident, fix the permission status if still unresolved, and refuse
     * denied entries.
     *
     * @throws UnknownOperationException if no such operation is registered
     * @throws OperationException        {@code LOAD_ERROR} if the handler could not be
     *                                   loaded (now or earlier), {@code PERMISSION_DENIED}
     *                                   if the gate refuses its category/action
     */
    public ResolvedOperation resolveForExecution(String name) {
        Slot slot = slot(name);
        if (slot.loadError != null) {
            throw loadError(slot.descriptor, slot.loadError, null);
        }
        if (slot.status == RegistrationStatus.DENIED) {
            throw permissionDenied(slot.descriptor);
        }
        Operation handler = slot.handler();
        if (slot.status != RegistrationStatus.CALLABLE) {
            throw permissionDenied(slot.descriptor);
        }
        return new ResolvedOperation(slot.descriptor, handler);
    }

    /** All entries, sorted by name. Pure read. */
    public List<RegistryEntry> snapshot() {
        return slots.values().stream()
                .map(Slot::entry)
                .sorted(Comparator.comparing(RegistryEntry::name))
                .toList();
    }

    /** Registered operation names (sorted). */
    public List<String> names() {
        return slots.keySet().stream().sorted().toList();
    }

    public int size() {
        return slots.size();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void insert(Slot slot) {
        Slot existing = slots.putIfAbsent(slot.descriptor.name(), slot);
        if (existing != null) {
            throw new IllegalStateException("Duplicate operation name: '" + slot.descriptor.name()
                    + "' (" + existing.descriptor.handlerRef() + " and " + slot.descriptor.handlerRef() + ")");
        }
    }

    private Slot slot(String name) {
        Slot slot = name == null ? null : slots.get(name);
        if (slot == null) {
            throw new UnknownOperationException(name);
        }
        return slot;
    }

    private RegistrationStatus evaluate(OperationDescriptor descriptor) {
        boolean allowed = gate.allowed(descriptor.category(), descriptor.action());
        if (!allowed) {
            log.info("[permissions] Operation '{}' is discoverable but not callable ({}/{})",
                    descriptor.name(), descriptor.category().key(), descriptor.action().key());
        }
        return allowed ? RegistrationStatus.CALLABLE : RegistrationStatus.DENIED;
    }

    private OperationException permissionDenied(OperationDescriptor d) {
        return new OperationException(OperationException.Kind.PERMISSION_DENIED,
                "Permission denied: operation '%s' requires %s/%s, which is disabled (override with %s=true)"
                        .formatted(d.name(), d.category().key(), d.action().key(),
                                gate.overrideKey(d.category(), d.action())));
    }

    private static OperationException loadError(OperationDescriptor d, String reason, Throwable cause) {
        return new OperationException(OperationException.Kind.LOAD_ERROR,
                "Operation '%s' could not be loaded and is disabled for this run: %s".formatted(d.name(), reason),
                cause);
    }

    private static String previewPathProblem(OperationDescriptor descriptor, Operation handler) {
        if (descriptor.isMutating() && !(handler instanceof MutatingOperation)) {
            return "Operation '" + descriptor.name() + "' is " + descriptor.action().key()
                    + " but " + handler.getClass().getName() + " has no preview path";
        }
        return null;
    }

    /**
     * Mutable registry slot. {@code status} and {@code loadError} are written
     * only by the loading thread, before the load future completes.
     */
    private final class Slot {

        final OperationDescriptor descriptor;
        final AtomicReference<CompletableFuture<Operation>> load = new AtomicReference<>();
        volatile RegistrationStatus status;
        volatile String loadError;

        Slot(OperationDescriptor descriptor, RegistrationStatus status) {
            this.descriptor = descriptor;
            this.status     = status;
        }

        Operation handler() {
            CompletableFuture<Operation> pending = load.get();
            if (pending == null) {
                CompletableFuture<Operation> mine = new CompletableFuture<>();
                if (load.compareAndSet(null, mine)) {
                    runLoad(mine);
                }
                pending = load.get();
            }
            try {
                return pending.join();
            } catch (CompletionException e) {
                throw loadError(descriptor, loadError, e.getCause());
            }
        }

        private void runLoad(CompletableFuture<Operation> future) {
            log.info("Loading handler for operation '{}' from {}", descriptor.name(), descriptor.handlerRef());
            try {
                Operation handler = loader.load(descriptor);
                String problem = handler == null ? "loader returned no handler" : mismatch(handler);
                if (problem != null) {
                    throw new IllegalStateException(problem);
                }
                if (status == RegistrationStatus.UNRESOLVED) {
                    status = evaluate(descriptor);
                }
                future.complete(handler);
            } catch (Exception | Error e) {
                fail(future, e);
            } finally {
                if (!future.isDone()) {
                    fail(future, new IllegalStateException("load ended without a handler"));
                }
            }
        }

        private void fail(CompletableFuture<Operation> future, Throwable e) {
            loadError = e.getClass().getSimpleName() + ": " + e.getMessage();
            status    = RegistrationStatus.DENIED;
            log.error("Failed to load operation '{}'; it stays disabled until restart", descriptor.name(), e);
            future.completeExceptionally(e);
        }

        private String mismatch(Operation handler) {
            String handlerName = handler.descriptor().name();
            if (!descriptor.name().equals(handlerName)) {
                return "manifest names '" + descriptor.name() + "' but handler " + handler.getClass().getName()
                        + " declares '" + handlerName + "'";
            }
            return previewPathProblem(descriptor, handler);
        }

        RegistryEntry entry() {
            CompletableFuture<Operation> current = load.get();
            boolean resident = current != null && current.isDone() && !current.isCompletedExceptionally();
            return new RegistryEntry(descriptor, status, loadError, resident);
        }
    }
}
