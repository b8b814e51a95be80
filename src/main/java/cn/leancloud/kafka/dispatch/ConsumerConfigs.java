package cn.leancloud.kafka.dispatch;

enum ConsumerConfigs implements KafkaConfigs {
    CLIENT_ID("client.id"),
    GROUP_ID("group.id"),
    ENABLE_AUTO_COMMIT("enable.auto.commit"),
    MAX_POLL_INTERVAL_MS("max.poll.interval.ms"),
    ENABLE_AUTO_OFFSET_STORE("enable.auto.offset.store", true),
    LOGGER("logger", true),
    ERROR_CB("error_cb", true);

    private String config;
    private boolean intercepted;

    ConsumerConfigs(String config) {
        this(config, false);
    }

    ConsumerConfigs(String config, boolean intercepted) {
        this.config = config;
        this.intercepted = intercepted;
    }

    @Override
    public String configName() {
        return config;
    }

    @Override
    public boolean intercepted() {
        return intercepted;
    }
}
