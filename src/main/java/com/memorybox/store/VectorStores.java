package com.memorybox.store;

import java.io.IOException;
import java.nio.file.Path;

import com.memorybox.runtime.AppConfig;

import redis.clients.jedis.JedisPooled;

public final class VectorStores {
    private VectorStores() {
    }

    public static VectorStore create(AppConfig config, String libraryUuid, Path dataFolder) throws IOException {
        if (config.getLibrary().isLocalMode()) {
            return new LocalVectorStore(dataFolder);
        }
        AppConfig.RedisConfig redis = config.getRedis();
        return new RedisVectorStore(new JedisPooled(redis.getHost(), redis.getPort()), redis.getKeyPrefix(), libraryUuid);
    }
}
