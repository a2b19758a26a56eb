package com.sqlcore.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

@ConfigurationProperties(prefix = AggregationConfig.PREFIX)
public class AggregationConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(AggregationConfig.class);

    public static final String PREFIX = "sqlcore.aggregate";
    public static final String DEFAULT_RESOURCE = "sqlcore.properties";

    /**
     * DECIMAL 聚合遇到不同 scale 的操作数时是否直接报错
     */
    private boolean strictScale = true;

    /**
     * NULL 结果的输出文本
     */
    private String nullLabel = "NULL";

    /**
     * 每个上下文池最多缓存的空闲上下文数
     */
    private int poolCapacity = 64;

    public static AggregationConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * 进程内共享的默认配置，首次使用时从 {@link #DEFAULT_RESOURCE} 加载一次。
     * 不要修改返回的实例，需要定制时用 {@link #load(String)} 或新建。
     */
    public static AggregationConfig getDefault() {
        return DefaultHolder.INSTANCE;
    }

    private static class DefaultHolder {
        static final AggregationConfig INSTANCE = load();
    }

    /**
     * 从 classpath 资源绑定配置，资源不存在时使用默认值
     */
    public static AggregationConfig load(String resource) {
        Properties props = new Properties();
        ClassLoader loader = AggregationConfig.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if(in == null) {
                LOGGER.warn("Config resource {} not found, using defaults", resource);
                return new AggregationConfig();
            }
            props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read config resource " + resource, e);
        }
        Binder binder = new Binder(new MapConfigurationPropertySource(props));
        AggregationConfig config = binder.bind(PREFIX, Bindable.of(AggregationConfig.class))
                .orElseGet(AggregationConfig::new);
        LOGGER.info("Loaded aggregation config from {}: {}", resource, config);
        return config;
    }

    public boolean isStrictScale() {
        return strictScale;
    }

    public void setStrictScale(boolean strictScale) {
        this.strictScale = strictScale;
    }

    public String getNullLabel() {
        return nullLabel;
    }

    public void setNullLabel(String nullLabel) {
        this.nullLabel = nullLabel;
    }

    public int getPoolCapacity() {
        return poolCapacity;
    }

    public void setPoolCapacity(int poolCapacity) {
        this.poolCapacity = poolCapacity;
    }

    @Override
    public String toString() {
        return "AggregationConfig{strictScale=" + strictScale
                + ", nullLabel='" + nullLabel + '\''
                + ", poolCapacity=" + poolCapacity + '}';
    }
}
