package hdlgen.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileWriterTest {

  @Test
  void testWritesFilesBelowBasePath(@TempDir Path dir) throws IOException {
    FileWriter writer = new FileWriter(dir.resolve("out").toString());
    writer.AddFile("a.sv", "module a ();\n");
    writer.AddFile("sub/b.sv", "first");
    writer.AddFile("sub/b.sv", "second");
    Assertions.assertEquals(2, writer.GetFiles().size());
    Assertions.assertTrue(writer.WriteFiles());
    Assertions.assertEquals("module a ();\n", Files.readString(dir.resolve("out/a.sv"), StandardCharsets.UTF_8));
    Assertions.assertEquals("second", Files.readString(dir.resolve("out/sub/b.sv"), StandardCharsets.UTF_8));
  }

  @Test
  void testReportsFailure(@TempDir Path dir) throws IOException {
    Path blocker = dir.resolve("blocker");
    Files.writeString(blocker, "not a directory");
    FileWriter writer = new FileWriter(blocker.toString());
    writer.AddFile("a.sv", "text");
    Assertions.assertFalse(writer.WriteFiles());
  }
}
