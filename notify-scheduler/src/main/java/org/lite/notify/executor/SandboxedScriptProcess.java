package org.lite.notify.executor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * A throwaway working directory plus the child process run inside it. The
 * directory and everything the script left in it are deleted on close.
 */
@Slf4j
public class SandboxedScriptProcess implements AutoCloseable {

    private static final String STDOUT_FILE = ".hook-stdout";
    private static final String STDERR_FILE = ".hook-stderr";

    private final Path workDir;

    private SandboxedScriptProcess(Path workDir) {
        this.workDir = workDir;
    }

    public static SandboxedScriptProcess create(String prefix) throws IOException {
        return new SandboxedScriptProcess(Files.createTempDirectory(prefix));
    }

    public Path getWorkDir() {
        return workDir;
    }

    public Path writeFile(String name, String content) throws IOException {
        return Files.writeString(workDir.resolve(name), content, StandardCharsets.UTF_8);
    }

    /**
     * Runs the command with the sandbox as working directory. A process still
     * alive at the deadline is killed together with its descendants.
     */
    public Execution run(List<String> command, Map<String, String> environment, Duration timeout)
            throws IOException, InterruptedException {
        Path stdout = workDir.resolve(STDOUT_FILE);
        Path stderr = workDir.resolve(STDERR_FILE);

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workDir.toFile());
        pb.redirectOutput(stdout.toFile());
        pb.redirectError(stderr.toFile());
        pb.environment().putAll(environment);

        log.debug("[Hook] Starting {} in {}", command, workDir);
        Process process = pb.start();
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                kill(process);
                return new Execution(-1, true, read(stdout), read(stderr));
            }
            return new Execution(process.exitValue(), false, read(stdout), read(stderr));
        } catch (InterruptedException e) {
            kill(process);
            throw e;
        }
    }

    @Override
    public void close() {
        try {
            FileSystemUtils.deleteRecursively(workDir);
        } catch (IOException e) {
            log.warn("[Hook] Failed to delete sandbox {}: {}", workDir, e.getMessage());
        }
    }

    private void kill(Process process) throws InterruptedException {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        process.waitFor(5, TimeUnit.SECONDS);
    }

    // Malformed bytes become U+FFFD; script output is not required to be valid UTF-8
    private static String read(Path file) throws IOException {
        return Files.exists(file) ? new String(Files.readAllBytes(file), StandardCharsets.UTF_8) : "";
    }

    public record Execution(int exitCode, boolean timedOut, String stdout, String stderr) {
    }
}
