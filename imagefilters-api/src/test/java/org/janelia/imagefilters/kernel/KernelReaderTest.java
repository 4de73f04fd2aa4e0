package org.janelia.imagefilters.kernel;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class KernelReaderTest {

    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    @Test
    public void parseKernel() {
        Kernel kernel = KernelReader.parseKernel("3\n0 1 0\n1 1 1\n0 1 0\n");
        assertEquals(1, kernel.getRadius());
        assertEquals(Kernels.cross(1), kernel);
    }

    @Test
    public void parseKernelWithArbitraryWhitespace() {
        Kernel kernel = KernelReader.parseKernel("  1\t\t-0.5  ");
        assertEquals(0, kernel.getRadius());
        assertEquals(-0.5f, kernel.get(0, 0), 0);

        Kernel kernel5 = KernelReader.parseKernel("5 " + "0.04 ".repeat(25));
        assertEquals(2, kernel5.getRadius());
        assertEquals(1, kernel5.sum(), 1e-5);
    }

    @Test
    public void malformedKernels() {
        String[] malformedSources = new String[] {
                "",
                "   \n ",
                "three 1 2 3",
                "3 1 2 3",
                "3 1 2 3 4 5 6 7 8 9 10",
                "3 1 2 3 4 x 6 7 8 9",
                "2 1 1 1 1",
                "0",
                "-1 1",
                "1 NaN"
        };
        for (String source : malformedSources) {
            try {
                KernelReader.parseKernel(source);
                fail("Expected a malformed kernel error for '" + source + "'");
            } catch (MalformedKernelSourceException e) {
                assertTrue(e instanceof IllegalArgumentException);
            }
        }
    }

    @Test
    public void sideWhoseSquareOverflowsAnIntIsRejected() {
        // 65537^2 wraps around to 131073 in int arithmetic
        String source = "65537" + " 0".repeat(131073);
        try {
            KernelReader.parseKernel(source);
            fail("Expected a malformed kernel error for a 65537x65537 kernel with 131073 weights");
        } catch (MalformedKernelSourceException e) {
            assertTrue(e.getMessage().contains("4295098369"));
        }
    }

    @Test
    public void readKernelFromFile() throws IOException {
        File kernelFile = testFolder.newFile("sharpen.txt");
        Files.write(kernelFile.toPath(), KernelReader.formatKernel(Kernels.sharpen()).getBytes(StandardCharsets.UTF_8));
        assertEquals(Kernels.sharpen(), KernelReader.readKernel(kernelFile.toPath()));
    }

    @Test
    public void readKernelFromStream() {
        Kernel kernel = KernelReader.readKernel(new ByteArrayInputStream("1 3".getBytes(StandardCharsets.UTF_8)));
        assertEquals(3, kernel.get(0, 0), 0);
    }

    @Test(expected = UncheckedIOException.class)
    public void readMissingKernelFile() {
        KernelReader.readKernel(testFolder.getRoot().toPath().resolve("missing.txt"));
    }
}
