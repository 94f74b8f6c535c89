package gpufleet.cloud.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

/**
 * Loads cloud and VM settings from an INI file with sections
 * [AUTH], [NETWORK], [VM] and [SSH].
 */
public final class IniLoader {

    private IniLoader() {
    }

    /**
     * @throws IllegalArgumentException if the file cannot be read or a required key is missing
     */
    public static CloudConfig load(File file) {
        Ini ini;
        try {
            ini = new Ini(file);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read cloud INI " + file + ": " + e.getMessage(), e);
        }

        Profile.Section auth = section(ini, "AUTH");
        Profile.Section net  = section(ini, "NETWORK");
        Profile.Section vm   = section(ini, "VM");
        Profile.Section ssh  = section(ini, "SSH");

        String keyText = opt(ssh, "public_key");
        String keyPath = opt(ssh, "public_key_path");
        if ((keyText == null || keyText.isBlank()) && keyPath != null && !keyPath.isBlank()) {
            try {
                keyText = Files.readString(new File(keyPath.trim()).toPath()).trim();
            } catch (IOException e) {
                throw new IllegalArgumentException("Cannot read SSH public key: " + keyPath, e);
            }
        }
        if (keyText == null || keyText.isBlank()) {
            throw new IllegalArgumentException("[SSH] public_key or public_key_path is required");
        }

        CloudConfig cfg = new CloudConfig();

        // AUTH
        cfg.oauthToken = opt(auth, "oauth_token");
        cfg.folderId   = required(auth, "folder_id");
        cfg.zoneId     = required(auth, "zone_id");

        // NETWORK
        cfg.subnetId        = required(net, "subnet_id");
        cfg.securityGroupId = opt(net, "security_group_id");
        cfg.publicIp        = Boolean.parseBoolean(opt(net, "public_ip", "true"));

        // VM
        cfg.imageId     = required(vm, "image_id");
        cfg.platformId  = opt(vm, "platform_id", "gpu-standard-v3");
        cfg.cpu         = intValue(vm, "cpu", "8");
        cfg.gpus        = intValue(vm, "gpus", "1");
        cfg.diskGb      = intValue(vm, "disk_gb", "200");
        cfg.diskType    = opt(vm, "disk_type", "network-ssd");
        cfg.preemptible = Boolean.parseBoolean(opt(vm, "preemptible", "true"));

        // SSH
        cfg.sshUser           = required(ssh, "user");
        cfg.sshPublicKey      = keyText.trim();
        cfg.sshPrivateKeyPath = opt(ssh, "private_key_path");
        cfg.sshPort           = intValue(ssh, "port", "22");
        cfg.workerLogPath     = opt(ssh, "worker_log_path", "/var/log/gpu-worker.log");

        return cfg;
    }

    // ===== helpers =====
    private static Profile.Section section(Ini ini, String name) {
        Profile.Section s = ini.get(name);
        if (s == null) {
            throw new IllegalArgumentException("Missing section [" + name + "]");
        }
        return s;
    }

    private static String required(Profile.Section s, String key) {
        String v = opt(s, key);
        if (v == null || v.isBlank()) {
            throw new IllegalArgumentException("Missing key '" + key + "' in [" + s.getName() + "]");
        }
        return v.trim();
    }

    private static int intValue(Profile.Section s, String key, String def) {
        String v = opt(s, key, def);
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for '" + key + "' in [" + s.getName() + "]: " + v);
        }
    }

    private static String opt(Profile.Section s, String key) {
        return s == null ? null : s.get(key);
    }

    private static String opt(Profile.Section s, String key, String def) {
        String v = opt(s, key);
        return (v == null || v.isBlank()) ? def : v.trim();
    }
}
