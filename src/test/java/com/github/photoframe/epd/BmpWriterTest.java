package com.github.photoframe.epd;

import com.badlogic.gdx.files.FileHandle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;

import static org.junit.jupiter.api.Assertions.*;

class BmpWriterTest {

    private static int int32(byte[] bytes, int at) {
        return (bytes[at] & 255) | (bytes[at + 1] & 255) << 8 | (bytes[at + 2] & 255) << 16 | (bytes[at + 3] & 255) << 24;
    }

    private static int int16(byte[] bytes, int at) {
        return (bytes[at] & 255) | (bytes[at + 1] & 255) << 8;
    }

    private static PixelBuffer threeByTwo() {
        PixelBuffer image = new PixelBuffer(3, 2, 3);
        image.setRGBA(0, 0, 0xFF0000FF);
        image.setRGBA(1, 0, 0x00FF00FF);
        image.setRGBA(2, 0, 0x0000FFFF);
        image.setRGBA(0, 1, 0x102030FF);
        image.setRGBA(1, 1, 0xFFFFFFFF);
        image.setRGBA(2, 1, 0x000000FF);
        return image;
    }

    @Test
    void headers() {
        byte[] bmp = new BmpWriter().encode(threeByTwo());
        assertEquals(78, bmp.length);
        assertEquals('B', bmp[0]);
        assertEquals('M', bmp[1]);
        assertEquals(78, int32(bmp, 2));
        assertEquals(0, int32(bmp, 6));
        assertEquals(54, int32(bmp, 10));
        assertEquals(40, int32(bmp, 14));
        assertEquals(3, int32(bmp, 18));
        assertEquals(2, int32(bmp, 22));
        assertEquals(1, int16(bmp, 26));
        assertEquals(24, int16(bmp, 28));
        assertEquals(0, int32(bmp, 30));
        assertEquals(24, int32(bmp, 34));
        assertEquals(2835, int32(bmp, 38));
        assertEquals(2835, int32(bmp, 42));
    }

    @Test
    void rowsAreBottomUpBgrAndPadded() {
        byte[] bmp = new BmpWriter().encode(threeByTwo());
        // first stored row is the bottom row of the image
        assertEquals(0x30, bmp[54] & 255);
        assertEquals(0x20, bmp[55] & 255);
        assertEquals(0x10, bmp[56] & 255);
        assertEquals(0xFF, bmp[57] & 255);
        assertEquals(0, bmp[60]);
        assertEquals(0, bmp[63]);
        assertEquals(0, bmp[64]);
        assertEquals(0, bmp[65]);
        // then the top row: red, green, blue as BGR
        assertEquals(0, bmp[66]);
        assertEquals(0, bmp[67]);
        assertEquals(0xFF, bmp[68] & 255);
        assertEquals(0, bmp[69]);
        assertEquals(0xFF, bmp[70] & 255);
        assertEquals(0, bmp[71]);
        assertEquals(0xFF, bmp[72] & 255);
        assertEquals(0, bmp[73]);
        assertEquals(0, bmp[74]);
    }

    @Test
    void sizesForPanel() {
        assertEquals(2400, BmpWriter.rowSize(800));
        assertEquals(4, BmpWriter.rowSize(1));
        assertEquals(54 + 2400 * 480, BmpWriter.fileSize(800, 480));
        assertEquals(BmpWriter.fileSize(800, 480),
                new BmpWriter().encode(new PixelBuffer(800, 480, 3)).length);
    }

    @Test
    void extraChannelsAreDropped() {
        PixelBuffer rgba = new PixelBuffer(1, 1, 4, new byte[]{1, 2, 3, 4});
        byte[] bmp = new BmpWriter().encode(rgba);
        assertEquals(58, bmp.length);
        assertEquals(3, bmp[54]);
        assertEquals(2, bmp[55]);
        assertEquals(1, bmp[56]);
        assertEquals(0, bmp[57]);
    }

    @Test
    void writerCanBeReused(@TempDir File dir) {
        BmpWriter writer = new BmpWriter();
        FileHandle big = new FileHandle(new File(dir, "big.bmp"));
        FileHandle small = new FileHandle(new File(dir, "small.bmp"));
        writer.write(big, new PixelBuffer(17, 5, 3).fill(9, 9, 9));
        writer.write(small, threeByTwo());
        assertEquals(BmpWriter.fileSize(17, 5), big.length());
        assertArrayEquals(new BmpWriter().encode(threeByTwo()), small.readBytes());
    }
}
