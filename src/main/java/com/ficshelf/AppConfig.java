package com.ficshelf;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Application configuration: which project to serve, where to log and on
 * which port to listen.
 */
public class AppConfig {

    private static final String APP_NAME = "FicShelf";

    private final Path projectPath;
    private final Path logPath;
    private final int port;
    private final boolean devMode;
    private final boolean initProject;
    private final String fanficfareCommand;

    private AppConfig(Path projectPath, Path logPath, int port, boolean devMode, boolean initProject, String fanficfareCommand) {
        this.projectPath = projectPath;
        this.logPath = logPath;
        this.port = port;
        this.devMode = devMode;
        this.initProject = initProject;
        this.fanficfareCommand = fanficfareCommand;
    }

    public Path getProjectPath() {
        return projectPath;
    }

    public Path getLogPath() {
        return logPath;
    }

    public int getPort() {
        return port;
    }

    public boolean isDevMode() {
        return devMode;
    }

    /**
     * Whether to create the project first if the path is not one yet.
     */
    public boolean isInitProject() {
        return initProject;
    }

    public String getFanficfareCommand() {
        return fanficfareCommand;
    }

    /**
     * Default project location.
     * Windows: %USERPROFILE%\Documents\FicShelf\project
     * macOS: ~/Documents/FicShelf/project
     * Linux: ~/FicShelf/project
     */
    public static Path getDefaultProjectPath() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String documents = System.getenv("USERPROFILE");
            if (documents == null) {
                documents = userHome;
            }
            return Paths.get(documents, "Documents", APP_NAME, "project");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Documents", APP_NAME, "project");
        } else {
            return Paths.get(userHome, APP_NAME, "project");
        }
    }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\FicShelf\logs
     * macOS: ~/Library/Logs/FicShelf
     * Linux: ~/.local/share/FicShelf/logs
     */
    public static Path getLogDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME, "logs");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Logs", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME, "logs");
        }
    }

    public static Path getLogFilePath() {
        return getLogDirectory().resolve("ficshelf.log");
    }

    /**
     * The preferred port if it is free, otherwise any free port.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            return preferredPort;
        }
    }

    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public static Path ensureLogDirectory() throws IOException {
        Files.createDirectories(getLogDirectory());
        return getLogFilePath();
    }

    public static class Builder {
        private Path projectPath = null;
        private Path logPath = null;
        private int preferredPort = 8080;
        private boolean devMode = false;
        private boolean initProject = false;
        private String fanficfareCommand = null;

        public Builder projectPath(String path) {
            if (path != null && !path.isEmpty()) {
                this.projectPath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder logPath(Path logPath) {
            this.logPath = logPath;
            return this;
        }

        public Builder port(int port) {
            this.preferredPort = port;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        public Builder initProject(boolean initProject) {
            this.initProject = initProject;
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                if (arg.startsWith("--project=")) {
                    projectPath(arg.substring("--project=".length()));
                } else if ("--project".equals(arg) && i + 1 < args.length) {
                    projectPath(args[++i]);
                } else if (arg.startsWith("--port=")) {
                    parsePort(arg.substring("--port=".length()));
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    parsePort(args[++i]);
                } else if (arg.startsWith("--fanficfare=")) {
                    this.fanficfareCommand = arg.substring("--fanficfare=".length());
                } else if ("--dev".equals(arg)) {
                    this.devMode = true;
                } else if ("--init".equals(arg)) {
                    this.initProject = true;
                } else {
                    throw new IllegalArgumentException("Unknown argument: " + arg);
                }
            }
            return this;
        }

        private void parsePort(String value) {
            try {
                this.preferredPort = Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port: " + value, e);
            }
        }

        public AppConfig build() throws IOException {
            Path project = projectPath != null ? projectPath : getDefaultProjectPath();
            int port = findAvailablePort(preferredPort);
            Path log = logPath != null ? logPath : ensureLogDirectory();
            return new AppConfig(project, log, port, devMode, initProject, fanficfareCommand);
        }
    }
}
