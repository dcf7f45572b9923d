package com.izapolsky.imagedownloader;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class ImageSinkImplTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private ImageSinkImpl toTest;

    @Before
    public void setUp() {
        toTest = new ImageSinkImpl();
    }

    @Test
    public void testWritesPng() throws Exception {
        File destination = new File(tmp.getRoot(), "rose.png");

        assertTrue(toTest.store(TestImages.tiny(), destination).isSuccess());

        BufferedImage read = ImageIO.read(destination);
        assertEquals(4, read.getWidth());
        assertEquals(0xff0000, read.getRGB(1, 1) & 0xffffff);
        assertEquals(1, tmp.getRoot().list().length);
    }

    @Test
    public void testConcurrentWritesOfSameDestination() throws Exception {
        File destination = new File(tmp.getRoot(), "rose.png");
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<StoreResult>> results = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                Callable<StoreResult> store = () -> {
                    start.await();
                    return toTest.store(TestImages.tiny(), destination);
                };
                results.add(pool.submit(store));
            }
            start.countDown();
            for (Future<StoreResult> result : results) {
                StoreResult stored = result.get();
                assertTrue(stored.getFailure(), stored.isSuccess());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(4, ImageIO.read(destination).getWidth());
        assertEquals(1, tmp.getRoot().list().length);
    }

    @Test
    public void testJpegWithAlphaConverted() throws Exception {
        BufferedImage argb = new BufferedImage(5, 5, BufferedImage.TYPE_INT_ARGB);
        File destination = new File(tmp.getRoot(), "rose.JPG");

        assertTrue(toTest.store(argb, destination).isSuccess());
        assertEquals(5, ImageIO.read(destination).getWidth());
    }

    @Test
    public void testReplacesExisting() throws Exception {
        File destination = tmp.newFile("rose.bmp");

        assertTrue(toTest.store(TestImages.tiny(), destination).isSuccess());
        assertEquals(3, ImageIO.read(destination).getHeight());
    }

    @Test
    public void testUnknownExtension() {
        File destination = new File(tmp.getRoot(), "rose.webp");

        StoreResult result = toTest.store(TestImages.tiny(), destination);

        assertFalse(result.isSuccess());
        assertFalse(destination.exists());
    }

    @Test
    public void testMissingFolderFails() {
        File destination = new File(new File(tmp.getRoot(), "nowhere"), "rose.png");

        StoreResult result = toTest.store(TestImages.tiny(), destination);

        assertFalse(result.isSuccess());
        assertFalse(destination.exists());
    }

    @Test
    public void testFormatFor() {
        assertEquals("jpeg", ImageSinkImpl.formatFor(new File("a.jpeg")));
        assertEquals("png", ImageSinkImpl.formatFor(new File("a.PNG")));
        assertNull(ImageSinkImpl.formatFor(new File("noextension")));
    }
}
