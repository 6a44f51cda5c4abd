package com.phillippitts.groundstation.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for thread pools.
 *
 * <p>Each satellite session occupies one delivery thread for its lifetime, so the delivery pool
 * must be at least as large as the expected number of concurrent satellites.
 */
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private DeliveryPoolProperties delivery = new DeliveryPoolProperties();
    private String listenerThreadName = "broker-listener";

    public DeliveryPoolProperties getDelivery() {
        return delivery;
    }

    public void setDelivery(DeliveryPoolProperties delivery) {
        this.delivery = delivery;
    }

    public String getListenerThreadName() {
        return listenerThreadName;
    }

    public void setListenerThreadName(String listenerThreadName) {
        this.listenerThreadName = listenerThreadName;
    }

    /**
     * Delivery executor pool configuration.
     */
    public static class DeliveryPoolProperties {
        private int corePoolSize = 4;
        private int maxPoolSize = 64;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "delivery-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
