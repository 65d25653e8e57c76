package com.questrail.webm.source;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import static com.questrail.webm.test.EbmlFixtures.bytes;
import static org.junit.jupiter.api.Assertions.*;

final class ChannelByteSourceTest
{
    @TempDir
    Path dir;

    @Test
    void readsAndSeeksAFile() throws IOException
    {
        Path file = Files.write(dir.resolve("data.bin"), bytes(10, 20, 30, 40));

        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            ChannelByteSource source = new ChannelByteSource(channel);
            assertEquals(4, source.size());

            source.seek(1);
            byte[] dst = new byte[2];
            assertEquals(2, source.read(dst, 0, 2));
            assertArrayEquals(bytes(20, 30), dst);
            assertEquals(3, source.position());

            source.seek(4);
            assertEquals(-1, source.read(dst, 0, 2));
        }
    }

    @Test
    void negativeSeekIsRejected() throws IOException
    {
        Path file = Files.write(dir.resolve("empty.bin"), new byte[0]);

        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            ChannelByteSource source = new ChannelByteSource(channel);
            assertThrows(IllegalArgumentException.class, () -> source.seek(-1));
        }
    }
}
