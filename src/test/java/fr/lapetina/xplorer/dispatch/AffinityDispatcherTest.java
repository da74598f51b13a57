package fr.lapetina.xplorer.dispatch;

import fr.lapetina.xplorer.domain.model.Request;
import fr.lapetina.xplorer.domain.model.Response;
import fr.lapetina.xplorer.domain.model.ResponseStatus;
import fr.lapetina.xplorer.routing.RouteEntry;
import fr.lapetina.xplorer.routing.Router;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AffinityDispatcherTest {

    private AffinityDispatcher dispatcher;
    private Router router;

    @BeforeEach
    void setUp() {
        dispatcher = AffinityDispatcher.builder()
                .ringBufferSize(64)
                .waitStrategy("sleeping")
                .build();
        dispatcher.start();
        router = new Router("Test", dispatcher);
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
    }

    private static Response threadName(Request request) {
        return Response.text(Thread.currentThread().getName());
    }

    @Nested
    @DisplayName("Thread placement")
    class ThreadPlacement {

        @Test
        @DisplayName("should run affinity handler on the affinity thread")
        void shouldRunOnAffinityThread() {
            router.register("/main", "", List.of(), true, AffinityDispatcherTest::threadName);

            Response response = router.handle(Request.of("/main"));

            assertThat(response.bodyAsString()).isEqualTo(AffinityDispatcher.AFFINITY_THREAD_NAME);
        }

        @Test
        @DisplayName("should run other handlers on a worker thread")
        void shouldRunOnWorkerThread() {
            router.register("/bg", "", List.of(), false, AffinityDispatcherTest::threadName);

            Response response = router.handle(Request.of("/bg"));

            assertThat(response.bodyAsString()).startsWith("xplorer-worker-");
        }

        @Test
        @DisplayName("should run mounted router handlers through the parent dispatcher")
        void shouldInheritDispatcher() {
            Router sub = new Router("Sub");
            sub.register("/main", AffinityDispatcherTest::threadName);
            router.mount("/sub", sub);

            Response response = router.handle(Request.of("/sub/main"));

            assertThat(response.bodyAsString()).isEqualTo(AffinityDispatcher.AFFINITY_THREAD_NAME);
        }

        @Test
        @DisplayName("should serialize concurrent affinity calls on one thread")
        void shouldSerializeConcurrentCalls() throws Exception {
            Set<String> threads = ConcurrentHashMap.newKeySet();
            router.register("/main", request -> {
                threads.add(Thread.currentThread().getName());
                return Response.text("ok");
            });

            ExecutorService callers = Executors.newFixedThreadPool(8);
            try {
                List<Future<Response>> futures = new ArrayList<>();
                for (int i = 0; i < 200; i++) {
                    futures.add(callers.submit(() -> router.handle(Request.of("/main"))));
                }
                for (Future<Response> future : futures) {
                    assertThat(future.get(5, TimeUnit.SECONDS).isOk()).isTrue();
                }
            } finally {
                callers.shutdownNow();
            }

            assertThat(threads).containsExactly(AffinityDispatcher.AFFINITY_THREAD_NAME);
        }
    }

    @Nested
    @DisplayName("Re-entrance")
    class Reentrance {

        @Test
        @DisplayName("should reject affinity call made from the affinity thread")
        void shouldRejectReentrantAffinityCall() {
            router.register("/inner", request -> Response.text("inner"));
            router.register("/outer", request -> {
                Response inner = router.handle(Request.of("/inner"));
                return Response.text(String.valueOf(inner.status().code()));
            });

            Response response = router.handle(Request.of("/outer"));

            assertThat(response.isOk()).isTrue();
            assertThat(response.bodyAsString()).isEqualTo("500");
        }

        @Test
        @DisplayName("should run non-affinity call made from the affinity thread inline")
        void shouldRunInlineFromAffinityThread() {
            router.register("/inner", "", List.of(), false, AffinityDispatcherTest::threadName);
            router.register("/outer", request -> router.handle(Request.of("/inner")));

            Response response = router.handle(Request.of("/outer"));

            assertThat(response.bodyAsString()).isEqualTo(AffinityDispatcher.AFFINITY_THREAD_NAME);
        }

        @Test
        @DisplayName("should let worker threads call affinity handlers")
        void shouldAllowWorkerToCallAffinity() {
            router.register("/main", AffinityDispatcherTest::threadName);
            router.register("/bg", "", List.of(), false, request -> router.handle(Request.of("/main")));

            Response response = router.handle(Request.of("/bg"));

            assertThat(response.bodyAsString()).isEqualTo(AffinityDispatcher.AFFINITY_THREAD_NAME);
        }

        @Test
        @DisplayName("should report the affinity thread")
        void shouldReportAffinityThread() {
            router.register("/check", request -> Response.text(String.valueOf(dispatcher.isAffinityThread())));

            assertThat(router.handle(Request.of("/check")).bodyAsString()).isEqualTo("true");
            assertThat(dispatcher.isAffinityThread()).isFalse();
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should propagate handler exception to the caller")
        void shouldPropagateHandlerException() {
            RouteEntry entry = new RouteEntry("/boom", "", List.of(), true, request -> {
                throw new IllegalArgumentException("boom");
            });

            assertThatThrownBy(() -> dispatcher.dispatch(entry, Request.of("/boom")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("boom");
        }

        @Test
        @DisplayName("should time out slow handler")
        void shouldTimeOut() {
            try (AffinityDispatcher bounded = AffinityDispatcher.builder().timeoutMs(50).build()) {
                bounded.start();
                RouteEntry slow = new RouteEntry("/slow", "", List.of(), false, request -> {
                    try {
                        Thread.sleep(500);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return Response.text("late");
                });

                assertThatThrownBy(() -> bounded.dispatch(slow, Request.of("/slow")))
                        .isInstanceOf(DispatchTimeoutException.class)
                        .hasMessageContaining("/slow");
            }
        }

        @Test
        @DisplayName("should map timeout to internal error through the router")
        void shouldMapTimeoutToInternalError() {
            try (AffinityDispatcher bounded = AffinityDispatcher.builder().timeoutMs(50).build()) {
                bounded.start();
                Router boundedRouter = new Router("Bounded", bounded);
                boundedRouter.register("/slow", request -> {
                    try {
                        Thread.sleep(500);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return Response.text("late");
                });

                Response response = boundedRouter.handle(Request.of("/slow"));

                assertThat(response.status()).isEqualTo(ResponseStatus.INTERNAL_ERROR);
            }
        }

        @Test
        @DisplayName("should reject dispatch once closed")
        void shouldRejectWhenClosed() {
            dispatcher.close();

            assertThatThrownBy(() -> dispatcher.dispatch(RouteEntry.of("/a", request -> Response.text("a")),
                    Request.of("/a")))
                    .isInstanceOf(IllegalStateException.class);
            assertThat(dispatcher.isRunning()).isFalse();
        }

        @Test
        @DisplayName("should reject ring buffer size that is not a power of 2")
        void shouldRejectRingBufferSize() {
            assertThatThrownBy(() -> AffinityDispatcher.builder().ringBufferSize(100))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
