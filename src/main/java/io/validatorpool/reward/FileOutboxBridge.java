package io.validatorpool.reward;

import io.validatorpool.model.BridgeMessage;
import io.validatorpool.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Bridge that drops each message as a JSON file into an outbox directory for a relayer to pick up.
 */
public final class FileOutboxBridge implements RewardBridge {
    private final Path outboxDir;

    public FileOutboxBridge(Path outboxDir) {
        this.outboxDir = outboxDir;
    }

    @Override
    public void send(BridgeMessage message) {
        String name = message.createdAt() + "_" + String.format("%012d", message.outboxId()) + ".json";
        Path target = outboxDir.resolve(name);
        Path tmp = outboxDir.resolve(name + ".tmp");
        try {
            Files.createDirectories(outboxDir);
            Files.writeString(tmp, Jsons.toJson(message), StandardCharsets.UTF_8);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write bridge message: " + target, e);
        }
    }

    public List<BridgeMessage> listSent() {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(outboxDir)) {
            return List.of();
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(outboxDir, "*.json")) {
            for (Path p : stream) {
                files.add(p);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list bridge outbox: " + outboxDir, e);
        }
        files.sort(null);
        List<BridgeMessage> out = new ArrayList<>(files.size());
        for (Path p : files) {
            try {
                out.add(Jsons.mapper().readValue(p.toFile(), BridgeMessage.class));
            } catch (IOException e) {
                throw new RuntimeException("Failed to read bridge message: " + p, e);
            }
        }
        return out;
    }
}
