package com.github.photoframe.epd;

import com.badlogic.gdx.files.FileHandle;
import com.badlogic.gdx.utils.GdxRuntimeException;
import com.badlogic.gdx.utils.JsonReader;
import com.badlogic.gdx.utils.JsonValue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class AlbumImageServiceTest {

    private static BufferedImage readPng(byte[] png) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(png));
        assertNotNull(image);
        return image;
    }

    @Test
    void statusReportsLibrary(@TempDir File dir) {
        AlbumImageService service = new AlbumImageService(AlbumLibrary.scan(AlbumLibraryTest.sampleAlbums(dir)),
                new SyntheticDecoder(), ProcessingParams.stock(false), AlbumImageService.ServeFormat.BMP);
        JsonValue status = new JsonReader().parse(service.status());
        assertEquals(3, status.getInt("totalImages"));
        assertEquals(2, status.getInt("albums"));
        assertEquals("bmp", status.getString("serveFormat"));
    }

    @Test
    void servesBmpAndCachesThumbnail(@TempDir File dir) {
        AlbumLibraryTest.touch(dir, "only/beach.jpg");
        SyntheticDecoder decoder = new SyntheticDecoder();
        AlbumImageService service = new AlbumImageService(AlbumLibrary.scan(new FileHandle(dir)),
                decoder, ProcessingParams.enhanced(false), AlbumImageService.ServeFormat.BMP, new Random(1));
        AlbumImageService.ServedImage served = service.serveRandom("frame.local:8080", 800, 480);
        assertEquals("image/bmp", served.contentType);
        assertEquals(BmpWriter.fileSize(800, 480), served.bytes.length);
        assertEquals("http://frame.local:8080/thumbnail?file=beach.jpg", served.thumbnailUrl);
        assertEquals("beach.jpg", served.entry.name);
        assertTrue(service.isThumbnailCached("beach.jpg"));

        assertNotNull(service.thumbnail("beach.jpg"));
        assertEquals(1, decoder.decodeCount);
    }

    @Test
    void servesPngAtRequestedSize(@TempDir File dir) throws IOException {
        AlbumLibraryTest.touch(dir, "only/portrait.jpg");
        AlbumImageService service = new AlbumImageService(AlbumLibrary.scan(new FileHandle(dir)),
                new SyntheticDecoder(), ProcessingParams.stock(false), AlbumImageService.ServeFormat.PNG);
        AlbumImageService.ServedImage served = service.serveRandom("localhost", 400, 240);
        assertEquals("image/png", served.contentType);
        BufferedImage image = readPng(served.bytes);
        assertEquals(400, image.getWidth());
        assertEquals(240, image.getHeight());
        for (int y = 0; y < 240; y += 11) {
            for (int x = 0; x < 400; x += 11) {
                assertTrue(Palette.THEORETICAL.isUsableColor(image.getRGB(x, y) << 8));
            }
        }
    }

    @Test
    void thumbnailsKeepOrientation(@TempDir File dir) throws IOException {
        AlbumImageService service = new AlbumImageService(AlbumLibrary.scan(AlbumLibraryTest.sampleAlbums(dir)),
                new SyntheticDecoder(), ProcessingParams.stock(false), AlbumImageService.ServeFormat.PNG);
        BufferedImage wide = readPng(service.thumbnail("x.jpg"));
        assertEquals(400, wide.getWidth());
        assertEquals(240, wide.getHeight());
        BufferedImage tall = readPng(service.thumbnail("portrait z.heic"));
        assertEquals(240, tall.getWidth());
        assertEquals(400, tall.getHeight());
    }

    @Test
    void unknownThumbnailIsNull(@TempDir File dir) {
        SyntheticDecoder decoder = new SyntheticDecoder();
        AlbumImageService service = new AlbumImageService(AlbumLibrary.scan(AlbumLibraryTest.sampleAlbums(dir)),
                decoder, ProcessingParams.stock(false), AlbumImageService.ServeFormat.PNG);
        assertNull(service.thumbnail("nowhere.jpg"));
        assertNull(service.thumbnail(null));
        assertEquals(0, decoder.decodeCount);
    }

    @Test
    void thumbnailIsMadeOnce(@TempDir File dir) {
        SyntheticDecoder decoder = new SyntheticDecoder();
        AlbumImageService service = new AlbumImageService(AlbumLibrary.scan(AlbumLibraryTest.sampleAlbums(dir)),
                decoder, ProcessingParams.stock(false), AlbumImageService.ServeFormat.PNG);
        byte[] first = service.thumbnail("y.PNG");
        byte[] second = service.thumbnail("y.PNG");
        assertSame(first, second);
        assertEquals(1, decoder.decodeCount);
    }

    @Test
    void decodeFailuresReachTheCaller(@TempDir File dir) {
        AlbumLibraryTest.touch(dir, "only/broken.jpg");
        AlbumImageService service = new AlbumImageService(AlbumLibrary.scan(new FileHandle(dir)),
                new SyntheticDecoder(), ProcessingParams.stock(false), AlbumImageService.ServeFormat.PNG);
        assertThrows(GdxRuntimeException.class, () -> service.serveRandom("localhost", 800, 480));
        assertFalse(service.isThumbnailCached("broken.jpg"));
    }

    @Test
    void thumbnailUrlEncodesSpaces() {
        assertEquals("http://h/thumbnail?file=my%20photo%26more.jpg",
                AlbumImageService.thumbnailUrl("h", "my photo&more.jpg"));
    }

    @Test
    void serveFormatNames() {
        assertSame(AlbumImageService.ServeFormat.PNG, AlbumImageService.ServeFormat.forName("PNG"));
        assertSame(AlbumImageService.ServeFormat.BMP, AlbumImageService.ServeFormat.forName("bmp"));
        assertThrows(IllegalArgumentException.class, () -> AlbumImageService.ServeFormat.forName("jpg"));
    }
}
