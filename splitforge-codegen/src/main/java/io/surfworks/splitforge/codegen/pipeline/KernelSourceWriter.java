package io.surfworks.splitforge.codegen.pipeline;

import io.surfworks.splitforge.codegen.CodegenException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes a compiled program to disk.
 *
 * <p>Layout for a function {@code f} compiled for CUDA:
 * <pre>
 * outputDir/
 * ├── f_host.c
 * ├── f_device.cu
 * └── f.manifest.json
 * </pre>
 * The device file is omitted when the program has no kernels.
 */
public final class KernelSourceWriter {

    private KernelSourceWriter() {} // Utility class

    /**
     * @return the files written, host file first
     * @throws CodegenException if a file cannot be written
     */
    public static List<Path> write(CompiledProgram program, Path outputDir) throws CodegenException {
        String name = program.name();
        Path host = outputDir.resolve(name + "_host." + program.hostTarget().fileExtension());
        Path device = outputDir.resolve(name + "_device." + program.target().fileExtension());
        Path manifest = outputDir.resolve(name + ".manifest.json");
        try {
            Files.createDirectories(outputDir);
            Files.writeString(host, program.hostSource(), StandardCharsets.UTF_8);
            Files.writeString(manifest, program.manifest().toJson(), StandardCharsets.UTF_8);
            if (program.deviceFunctions().isEmpty()) {
                return List.of(host, manifest);
            }
            Files.writeString(device, program.deviceSource(), StandardCharsets.UTF_8);
            return List.of(host, device, manifest);
        } catch (IOException e) {
            throw new CodegenException("Failed to write sources for " + name + " to " + outputDir, e);
        }
    }
}
