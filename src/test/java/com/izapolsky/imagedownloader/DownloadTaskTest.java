package com.izapolsky.imagedownloader;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class DownloadTaskTest {

    private static final String URL = "http://example.com/images/rose.jpg";

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private File outputFolder;
    private File destination;
    private AtomicInteger fetches;
    private CompletionCounter counter;

    @Before
    public void setUp() throws Exception {
        outputFolder = new File(tmp.getRoot(), "images");
        destination = DestinationNames.destinationFor(outputFolder, URL);
        fetches = new AtomicInteger();
        counter = new CompletionCounter(1);
    }

    private DownloadTask task(int maxAttempts, ImageFetcher fetcher, ImageSink sink) {
        DownloadSettings settings = TestImages.quickSettings(outputFolder).maxAttempts(maxAttempts).build();
        return new DownloadTask(URL, destination, new RetryPolicyImpl(settings), fetcher, sink, new LocalStorageImpl(), counter);
    }

    private ImageFetcher failing() {
        return url -> {
            fetches.incrementAndGet();
            return FetchResult.failure("refused");
        };
    }

    private ImageFetcher succeedingOn(int attempt) {
        return url -> fetches.incrementAndGet() >= attempt ? FetchResult.success(TestImages.tiny()) : FetchResult.failure("flaky");
    }

    @Test
    public void testSucceedsOnFirstAttempt() {
        DownloadTask toTest = task(3, succeedingOn(1), new ImageSinkImpl());

        assertEquals(Outcome.SUCCEEDED, toTest.call());
        assertEquals(1, fetches.get());
        assertEquals(1, toTest.getAttempt());
        assertEquals(1, counter.get());
        assertTrue("Image written", destination.isFile());
    }

    @Test
    public void testOutputFolderCreatedLazily() {
        assertFalse(outputFolder.exists());
        task(1, succeedingOn(1), TestImages.touchingSink()).call();
        assertTrue(outputFolder.isDirectory());
    }

    @Test
    public void testRetriesUntilSuccess() {
        DownloadTask toTest = task(5, succeedingOn(3), TestImages.touchingSink());

        assertEquals(Outcome.SUCCEEDED, toTest.call());
        assertEquals(3, fetches.get());
        assertEquals(1, counter.get());
    }

    @Test
    public void testExactlyMaxAttemptsFetches() {
        DownloadTask toTest = task(4, failing(), TestImages.touchingSink());

        assertEquals(Outcome.PERMANENTLY_FAILED, toTest.call());
        assertEquals(4, fetches.get());
        assertEquals(0, counter.get());
        assertFalse(destination.exists());
    }

    @Test
    public void testZeroAttemptsNeverFetches() {
        DownloadTask toTest = task(0, failing(), TestImages.touchingSink());

        assertEquals(Outcome.PERMANENTLY_FAILED, toTest.call());
        assertEquals(0, fetches.get());
    }

    @Test
    public void testExistingDestinationSkipped() throws Exception {
        assertTrue(outputFolder.mkdirs());
        assertTrue(destination.createNewFile());

        DownloadTask toTest = task(3, failing(), (image, dest) -> {
            throw new AssertionError("Sink must not be called");
        });

        assertEquals(Outcome.SKIPPED, toTest.call());
        assertEquals(0, fetches.get());
        assertEquals(1, counter.get());
    }

    @Test
    public void testSinkFailureIsRetried() {
        AtomicInteger stores = new AtomicInteger();
        ImageSink sink = (image, dest) -> stores.incrementAndGet() == 1
                ? StoreResult.failure("disk full", null)
                : TestImages.touchingSink().store(image, dest);

        DownloadTask toTest = task(3, succeedingOn(1), sink);

        assertEquals(Outcome.SUCCEEDED, toTest.call());
        assertEquals(2, fetches.get());
        assertEquals(2, stores.get());
    }

    @Test
    public void testUnexpectedExceptionCountsAsAttempt() {
        DownloadTask toTest = task(2, url -> {
            fetches.incrementAndGet();
            throw new IllegalStateException("bug in fetcher");
        }, TestImages.touchingSink());

        assertEquals(Outcome.PERMANENTLY_FAILED, toTest.call());
        assertEquals(2, fetches.get());
    }

    @Test
    public void testInterruptedWhileSleepingStops() {
        DownloadSettings settings = DownloadSettings.builder().outputFolder(outputFolder).maxAttempts(3)
                .sleepTime(10, TimeUnit.SECONDS).build();
        DownloadTask toTest = new DownloadTask(URL, destination, new RetryPolicyImpl(settings), failing(),
                TestImages.touchingSink(), new LocalStorageImpl(), counter);

        Thread.currentThread().interrupt();
        try {
            assertEquals(Outcome.TIMED_OUT, toTest.call());
            assertEquals(0, fetches.get());
        } finally {
            assertTrue("Interrupt flag restored", Thread.interrupted());
        }
    }
}
