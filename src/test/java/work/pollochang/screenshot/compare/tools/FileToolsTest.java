package work.pollochang.screenshot.compare.tools;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class FileToolsTest {

    @Test
    void testDiffFileName_ShouldUseBothStems() {
        assertEquals("diff_login_login-new.png",
                FileTools.diffFileName(Paths.get("shots", "login.png"), Paths.get("run", "login-new.png")));
        assertEquals("diff_a.b_c.png", FileTools.diffFileName(Paths.get("a.b.png"), Paths.get("c")));
    }

    @Test
    void testStem_ShouldKeepHiddenFileName() {
        assertEquals(".hidden", FileTools.stem(Paths.get(".hidden")));
    }

    @Test
    void testExtension_ShouldIncludeDot() {
        assertEquals(".png", FileTools.extension(Paths.get("a.b.png")));
        assertEquals("", FileTools.extension(Paths.get(".hidden")));
        assertEquals("", FileTools.extension(Paths.get("README")));
    }

    @Test
    void testIsScreenshot_ShouldIgnoreCaseAndOtherTypes(@TempDir Path tempDir) throws IOException {
        assertTrue(FileTools.isScreenshot(Files.createFile(tempDir.resolve("a.PNG"))));
        assertTrue(FileTools.isScreenshot(Files.createFile(tempDir.resolve("b.jpeg"))));
        assertFalse(FileTools.isScreenshot(Files.createFile(tempDir.resolve("c.gif"))));
        assertFalse(FileTools.isScreenshot(Files.createDirectory(tempDir.resolve("d.png"))));
    }

    @Test
    void testEnsureDirectoryExists_ShouldCreateNestedDirectories(@TempDir Path tempDir) {
        Path nested = tempDir.resolve("a").resolve("b");

        FileTools.ensureDirectoryExists(nested);
        FileTools.ensureDirectoryExists(nested);

        assertTrue(Files.isDirectory(nested));
    }

    @Test
    void testEnsureDirectoryExists_ShouldFailWhenPathIsFile(@TempDir Path tempDir) throws IOException {
        Path file = Files.createFile(tempDir.resolve("file.txt"));

        assertThrows(RuntimeException.class, () -> FileTools.ensureDirectoryExists(file.resolve("child")));
    }

    @Test
    void testIsReadableFile(@TempDir Path tempDir) throws IOException {
        Path file = Files.createFile(tempDir.resolve("x.png"));

        assertTrue(FileTools.isReadableFile(file));
        assertFalse(FileTools.isReadableFile(tempDir));
        assertFalse(FileTools.isReadableFile(tempDir.resolve("missing.png")));
    }
}
