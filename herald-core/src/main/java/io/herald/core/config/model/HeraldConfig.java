package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HeraldConfig(
    StoreConfig store,
    SchedulerConfig scheduler,
    ChannelsConfig channels
) {

    public HeraldConfig {
        store = store == null ? StoreConfig.defaults() : store;
        scheduler = scheduler == null ? SchedulerConfig.defaults() : scheduler;
        channels = channels == null ? ChannelsConfig.defaults() : channels;
    }

    public static HeraldConfig defaults() {
        return new HeraldConfig(
            StoreConfig.defaults(),
            SchedulerConfig.defaults(),
            ChannelsConfig.defaults()
        );
    }
}
