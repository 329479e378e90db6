package net.eventmail.core.spi;

import java.io.File;
import java.io.IOException;
import java.util.List;

@FunctionalInterface
public interface ProcessLauncher {
    /** stdout/stderr는 파이프로 (상속 X). workingDirectory null이면 현재 디렉터리 */
    Process start(List<String> command, File workingDirectory) throws IOException;

    static ProcessLauncher system() {
        return (command, dir) -> new ProcessBuilder(command)
                .directory(dir)
                .redirectOutput(ProcessBuilder.Redirect.PIPE)
                .redirectError(ProcessBuilder.Redirect.PIPE)
                .start();
    }
}
