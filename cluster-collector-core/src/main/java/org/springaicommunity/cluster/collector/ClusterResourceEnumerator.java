package org.springaicommunity.cluster.collector;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Lists every resource a {@link CollectionRun} asks for.
 *
 * <p>
 * Each (type, namespace) pair is an independent task on a fixed-size worker pool. A task
 * that fails is recorded as a {@link FetchFailure} in the tracker and never affects its
 * siblings. Records are handed to the {@link ResourceSink} on the worker thread as each
 * page arrives, so nothing is buffered beyond one page per task.
 *
 * <p>
 * A configured run deadline is fixed when enumeration starts and also bounds the namespace
 * and definition discovery calls. When it passes, running tasks are interrupted and every
 * unfinished task is recorded as cancelled. No record reaches the sink afterwards.
 */
public class ClusterResourceEnumerator {

	private static final Logger logger = LoggerFactory.getLogger(ClusterResourceEnumerator.class);

	static final String DEADLINE_REASON = "cancelled: run deadline exceeded";

	/**
	 * How long interrupted tasks get to wind down after the deadline.
	 */
	private static final Duration CANCEL_GRACE = Duration.ofSeconds(5);

	private final KubeApiService apiService;

	private final int concurrency;

	private final Duration runDeadline;

	/**
	 * Create an enumerator.
	 * @param apiService typed API access
	 * @param concurrency maximum number of list requests in flight
	 * @param runDeadline overall deadline, {@link Duration#ZERO} for none
	 */
	public ClusterResourceEnumerator(KubeApiService apiService, int concurrency, Duration runDeadline) {
		if (concurrency < 1) {
			throw new IllegalArgumentException("concurrency must be at least 1");
		}
		this.apiService = apiService;
		this.concurrency = concurrency;
		this.runDeadline = runDeadline;
	}

	public ClusterResourceEnumerator(KubeApiService apiService, CollectionProperties properties) {
		this(apiService, properties.getFetchConcurrency(), Duration.ofSeconds(properties.getRunDeadlineSeconds()));
	}

	/**
	 * Enumerate the resources of a run.
	 * @param run the run configuration
	 * @param tracker receives fetch outcomes
	 * @param sink receives records
	 * @return enumeration outcome
	 */
	public EnumerationResult enumerate(CollectionRun run, CollectionTracker tracker, ResourceSink sink) {
		Deadline deadline = Deadline.after(runDeadline);
		ExecutorService executor = Executors.newFixedThreadPool(concurrency, new FetchThreadFactory());
		try {
			List<String> namespaces = resolveNamespaces(run, tracker, sink, executor, deadline);
			List<ResourceType> customTypes = discoverCustomResources(run, tracker, sink, executor, deadline);

			List<FetchTask> tasks = new ArrayList<>();
			for (ResourceType type : ResourceCatalog.CLUSTER_SCOPED) {
				tasks.add(new FetchTask(type, ""));
			}
			customTypes.stream()
				.filter(type -> !type.isNamespaced())
				.forEach(type -> tasks.add(new FetchTask(type, "")));
			for (String namespace : namespaces) {
				for (ResourceType type : ResourceCatalog.NAMESPACE_SCOPED) {
					tasks.add(new FetchTask(type, namespace));
				}
				customTypes.stream()
					.filter(ResourceType::isNamespaced)
					.forEach(type -> tasks.add(new FetchTask(type, namespace)));
			}

			logger.info("Listing {} resource types across {} namespaces ({} requests, concurrency {})",
					ResourceCatalog.CLUSTER_SCOPED.size() + ResourceCatalog.NAMESPACE_SCOPED.size()
							+ customTypes.size(),
					namespaces.size(), tasks.size(), concurrency);

			boolean deadlineExceeded = runTasks(executor, tasks, tracker, sink, deadline);
			int failed = tracker.fetchFailures().size();
			return new EnumerationResult(namespaces, customTypes, tasks.size(), failed, deadlineExceeded);
		}
		finally {
			executor.shutdownNow();
		}
	}

	/**
	 * Without a filter every visible namespace is targeted. With a filter, names not
	 * present on the cluster are skipped, unless the namespace list itself is unreadable,
	 * in which case the filter is trusted as given.
	 */
	private List<String> resolveNamespaces(CollectionRun run, CollectionTracker tracker, ResourceSink sink,
			ExecutorService executor, Deadline deadline) {
		List<String> visible;
		try {
			visible = callBeforeDeadline(executor, apiService::listNamespaces, deadline);
			sink.namespacesDiscovered(visible);
		}
		catch (TimeoutException e) {
			logger.warn("Run deadline of {}s exceeded while listing namespaces", runDeadline.toSeconds());
			tracker.recordFetchFailure(
					new FetchFailure(ResourceCatalog.NAMESPACES.directoryName(), "", -1, DEADLINE_REASON));
			return trustFilter(run, sink);
		}
		catch (KubeApiException e) {
			if (run.allNamespaces()) {
				logger.warn("Cannot list namespaces ({}); only cluster-scoped resources will be collected",
						e.getMessage());
				tracker.recordFetchFailure(FetchFailure.of(ResourceCatalog.NAMESPACES, "", e));
				return List.of();
			}
			logger.warn("Cannot list namespaces ({}); using namespace filter as given", e.getMessage());
			return trustFilter(run, sink);
		}

		if (run.allNamespaces()) {
			logger.info("Collecting from all {} namespaces", visible.size());
			return visible;
		}

		Set<String> existing = new LinkedHashSet<>(visible);
		List<String> targets = new ArrayList<>();
		for (String namespace : run.namespaceFilter().stream().sorted().toList()) {
			if (existing.contains(namespace)) {
				targets.add(namespace);
			}
			else {
				logger.warn("Namespace '{}' not found on the cluster, skipping", namespace);
			}
		}
		logger.info("Collecting from namespaces {}", targets);
		return targets;
	}

	private static List<String> trustFilter(CollectionRun run, ResourceSink sink) {
		List<String> filter = run.namespaceFilter().stream().sorted().toList();
		if (!filter.isEmpty()) {
			sink.namespacesDiscovered(filter);
		}
		return filter;
	}

	/**
	 * Read custom resource definitions when custom resources are collected (the
	 * definitions are then collected too) or when detection needs them (observed only).
	 */
	private List<ResourceType> discoverCustomResources(CollectionRun run, CollectionTracker tracker,
			ResourceSink sink, ExecutorService executor, Deadline deadline) {
		if (!run.includeCustomResources() && !run.detectionEnabled()) {
			return List.of();
		}
		ResourceType crdType = ResourceCatalog.CUSTOM_RESOURCE_DEFINITIONS;
		List<JsonNode> definitions;
		try {
			definitions = callBeforeDeadline(executor, apiService::listCustomResourceDefinitions, deadline);
		}
		catch (TimeoutException e) {
			logger.warn("Run deadline of {}s exceeded while listing custom resource definitions",
					runDeadline.toSeconds());
			if (run.includeCustomResources()) {
				tracker.recordFetchFailure(new FetchFailure(crdType.directoryName(), "", -1, DEADLINE_REASON));
			}
			return List.of();
		}
		catch (KubeApiException e) {
			if (run.includeCustomResources()) {
				logger.warn("Cannot list custom resource definitions: {}", e.getMessage());
				tracker.recordFetchFailure(FetchFailure.of(crdType, "", e));
			}
			else {
				logger.debug("Custom resource definitions unavailable for detection: {}", e.getMessage());
			}
			return List.of();
		}

		List<ResourceType> types = new ArrayList<>();
		for (JsonNode definition : definitions) {
			ResourceRecord record = toRecord(crdType, "", definition);
			if (record == null) {
				continue;
			}
			if (run.includeCustomResources()) {
				sink.accept(record);
				ResourceCatalog.fromCustomResourceDefinition(definition).ifPresentOrElse(types::add,
						() -> logger.warn("Custom resource definition {} serves no usable version", record.name()));
			}
			else {
				sink.observe(record);
			}
		}
		if (run.includeCustomResources()) {
			tracker.recordFetchSuccess();
			logger.info("Discovered {} custom resource types", types.size());
		}
		return types;
	}

	/**
	 * Run a discovery call on the pool and wait for it no longer than the run deadline.
	 * @throws TimeoutException if the deadline passed first; the call is then interrupted
	 */
	private static <T> T callBeforeDeadline(ExecutorService executor, Callable<T> call, Deadline deadline)
			throws TimeoutException {
		Future<T> future = executor.submit(call);
		try {
			return deadline.bounded() ? future.get(deadline.remainingNanos(), TimeUnit.NANOSECONDS) : future.get();
		}
		catch (TimeoutException e) {
			future.cancel(true);
			throw e;
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			future.cancel(true);
			throw new TimeoutException("Interrupted while waiting for discovery");
		}
		catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			if (cause instanceof Error) {
				throw (Error) cause;
			}
			throw new IllegalStateException(cause);
		}
	}

	private boolean runTasks(ExecutorService executor, List<FetchTask> tasks, CollectionTracker tracker,
			ResourceSink sink, Deadline deadline) {
		Set<FetchTask> settled = ConcurrentHashMap.newKeySet();
		WriteGate gate = new WriteGate();

		boolean deadlineExceeded = deadline.passed();
		if (!deadlineExceeded) {
			for (FetchTask task : tasks) {
				executor.execute(() -> runTask(task, tracker, sink, settled, gate));
			}
		}
		executor.shutdown();

		try {
			if (!deadlineExceeded) {
				boolean finished = deadline.bounded()
						? executor.awaitTermination(deadline.remainingNanos(), TimeUnit.NANOSECONDS)
						: executor.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
				deadlineExceeded = !finished;
			}
			if (deadlineExceeded) {
				logger.warn("Run deadline of {}s exceeded; cancelling pending requests", runDeadline.toSeconds());
				gate.close();
				executor.shutdownNow();
				executor.awaitTermination(CANCEL_GRACE.toMillis(), TimeUnit.MILLISECONDS);
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			deadlineExceeded = true;
			gate.close();
			executor.shutdownNow();
		}

		if (deadlineExceeded) {
			int cancelled = 0;
			for (FetchTask task : tasks) {
				if (settled.add(task)) {
					tracker.recordFetchFailure(new FetchFailure(task.type().directoryName(), task.namespace(), -1,
							DEADLINE_REASON));
					cancelled++;
				}
			}
			logger.warn("{} list requests cancelled by the run deadline", cancelled);
		}
		return deadlineExceeded;
	}

	private void runTask(FetchTask task, CollectionTracker tracker, ResourceSink sink, Set<FetchTask> settled,
			WriteGate gate) {
		try {
			int count = apiService.forEachResource(task.type(), task.listNamespace(), item -> {
				ResourceRecord record = toRecord(task.type(), task.namespace(), item);
				if (record != null) {
					gate.pass(() -> sink.accept(record));
				}
			});
			if (settled.add(task)) {
				tracker.recordFetchSuccess();
				logger.debug("Listed {} {}{}", count, task.type(), task.describeNamespace());
			}
		}
		catch (KubeApiException e) {
			if (settled.add(task)) {
				String reason = gate.isClosed() ? DEADLINE_REASON : e.getMessage();
				tracker.recordFetchFailure(
						new FetchFailure(task.type().directoryName(), task.namespace(), e.getStatusCode(), reason));
				logFailure(task, e);
			}
		}
		catch (RuntimeException e) {
			if (settled.add(task)) {
				tracker.recordFetchFailure(
						new FetchFailure(task.type().directoryName(), task.namespace(), -1, e.toString()));
				logger.warn("Listing {}{} failed unexpectedly", task.type(), task.describeNamespace(), e);
			}
		}
	}

	private static void logFailure(FetchTask task, KubeApiException e) {
		if (e.isForbidden()) {
			logger.warn("Permission denied listing {}{}, skipping", task.type(), task.describeNamespace());
		}
		else if (e.isNotFound()) {
			logger.warn("{} not served by the cluster{}, skipping", task.type(), task.describeNamespace());
		}
		else {
			logger.warn("Failed to list {}{}: {}", task.type(), task.describeNamespace(), e.getMessage());
		}
	}

	/**
	 * Build a record from a listed item. Items without a name are skipped.
	 */
	@Nullable
	private static ResourceRecord toRecord(ResourceType type, String namespace, JsonNode item) {
		JsonNode metadata = item.path("metadata");
		String name = metadata.path("name").asText("");
		String itemNamespace = metadata.path("namespace").asText(namespace);
		try {
			return ResourceRecord.of(type, itemNamespace.isEmpty() ? namespace : itemNamespace, name, item);
		}
		catch (IllegalArgumentException e) {
			logger.warn("Skipping malformed {} item: {}", type, e.getMessage());
			return null;
		}
	}

	/**
	 * One list request: a type in a namespace, or cluster wide when the namespace is
	 * empty.
	 */
	private record FetchTask(ResourceType type, String namespace) {

		@Nullable
		String listNamespace() {
			return namespace.isEmpty() ? null : namespace;
		}

		String describeNamespace() {
			return namespace.isEmpty() ? "" : " in " + namespace;
		}

	}

	/**
	 * A single run deadline, fixed when enumeration starts.
	 */
	private record Deadline(long expiresAtNanos, boolean bounded) {

		static Deadline after(Duration duration) {
			if (duration.isZero() || duration.isNegative()) {
				return new Deadline(0, false);
			}
			return new Deadline(System.nanoTime() + duration.toNanos(), true);
		}

		long remainingNanos() {
			return expiresAtNanos - System.nanoTime();
		}

		boolean passed() {
			return bounded && remainingNanos() <= 0;
		}

	}

	/**
	 * Admits sink writes until closed. Closing waits for writes in progress, so none
	 * happens once {@link #close()} returns.
	 */
	private static final class WriteGate {

		private final ReadWriteLock lock = new ReentrantReadWriteLock();

		private boolean closed;

		void pass(Runnable write) {
			lock.readLock().lock();
			try {
				if (!closed) {
					write.run();
				}
			}
			finally {
				lock.readLock().unlock();
			}
		}

		void close() {
			lock.writeLock().lock();
			try {
				closed = true;
			}
			finally {
				lock.writeLock().unlock();
			}
		}

		boolean isClosed() {
			lock.readLock().lock();
			try {
				return closed;
			}
			finally {
				lock.readLock().unlock();
			}
		}

	}

	private static final class FetchThreadFactory implements ThreadFactory {

		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, "cluster-fetch-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}

	}

}
