package info.isaksson.erland.vbform.parser.resource;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class FileResourceResolverTest {

    private static final byte[] FRX = {0x02, 'h', 'i', (byte) 0xFF, 0x02, 0x00, 'o', 'k'};

    @Test
    void resolvesRelativeToBaseDirectoryWithBackslashes() throws Exception {
        Path dir = Files.createTempDirectory("vbform-frx-");
        Files.createDirectories(dir.resolve("forms"));
        Files.write(dir.resolve("forms/Main.frx"), FRX);

        FileResourceResolver resolver = new FileResourceResolver(dir);

        assertEquals("ok", new String(resolver.resolve("forms\\Main.frx", 3), StandardCharsets.US_ASCII));
        assertEquals("hi", new String(resolver.resolve("forms/Main.frx", 0), StandardCharsets.US_ASCII));
    }

    @Test
    void cachedBufferSurvivesFileRemoval() throws Exception {
        Path dir = Files.createTempDirectory("vbform-frx-");
        Path frx = dir.resolve("Main.frx");
        Files.write(frx, FRX);

        FileResourceResolver cached = new FileResourceResolver(dir, true);
        FileResourceResolver uncached = new FileResourceResolver(dir, false);
        cached.resolve("Main.frx", 0);
        uncached.resolve("Main.frx", 0);
        Files.delete(frx);

        assertArrayEquals(new byte[]{'o', 'k'}, cached.resolve("Main.frx", 3));
        assertThrows(IOException.class, () -> uncached.resolve("Main.frx", 3));
    }

    @Test
    void missingFileIsIoError() throws Exception {
        Path dir = Files.createTempDirectory("vbform-frx-");
        FileResourceResolver resolver = new FileResourceResolver(dir);

        IOException e = assertThrows(IOException.class, () -> resolver.resolve("Nope.frx", 0));
        assertFalse(e instanceof CorruptedResourceException);
        assertThrows(IOException.class, () -> resolver.resolve("", 0));
    }

    @Test
    void offsetPastEndOfFileIsReportedAsOutOfBounds() throws Exception {
        Path dir = Files.createTempDirectory("vbform-frx-");
        Files.write(dir.resolve("Main.frx"), FRX);

        assertThrows(ResourceOffsetOutOfBoundsException.class,
                () -> new FileResourceResolver(dir).resolve("Main.frx", FRX.length));
    }

    @Test
    void namesOutsideBaseDirectoryAreRejected() throws Exception {
        Path dir = Files.createTempDirectory("vbform-frx-");
        Path forms = Files.createDirectories(dir.resolve("forms"));
        Files.write(dir.resolve("shared.frx"), FRX);
        Files.write(forms.resolve("Main.frx"), FRX);
        FileResourceResolver resolver = new FileResourceResolver(forms);

        assertThrows(IOException.class, () -> resolver.resolve("..\\shared.frx", 0));
        assertThrows(IOException.class, () -> resolver.resolve("../forms/../shared.frx", 0));
        assertThrows(IOException.class, () -> resolver.resolve(dir.resolve("shared.frx").toString(), 0));
        assertArrayEquals(new byte[]{'h', 'i'}, resolver.resolve("sub\\..\\Main.frx", 0));
    }

    @Test
    void unusableFileNameIsIoError() throws Exception {
        FileResourceResolver resolver = new FileResourceResolver(Files.createTempDirectory("vbform-frx-"));

        IOException e = assertThrows(IOException.class, () -> resolver.resolve("a\0b.frx", 0));
        assertFalse(e instanceof CorruptedResourceException);
    }
}
