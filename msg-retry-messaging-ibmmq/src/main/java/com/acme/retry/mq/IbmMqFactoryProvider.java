package com.acme.retry.mq;

import static com.ibm.msg.client.jakarta.jms.JmsConstants.*;
import static com.ibm.msg.client.jakarta.wmq.common.CommonConstants.*;

import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import io.micronaut.jms.annotations.JMSConnectionFactory;

/** IBM MQ connection factory configured from the {@code MQ_*} environment variables. */
@Requires(notEnv = "test")
@Factory
public class IbmMqFactoryProvider {

  @JMSConnectionFactory("mqConnectionFactory")
  public jakarta.jms.ConnectionFactory mqConnectionFactory() throws Exception {
    var cf = new com.ibm.mq.jakarta.jms.MQConnectionFactory();
    cf.setTransportType(WMQ_CM_CLIENT);
    cf.setHostName(System.getenv().getOrDefault("MQ_HOST", "localhost"));
    cf.setPort(Integer.parseInt(System.getenv().getOrDefault("MQ_PORT", "1414")));
    cf.setQueueManager(System.getenv().getOrDefault("MQ_QMGR", "QM1"));
    cf.setChannel(System.getenv().getOrDefault("MQ_CHANNEL", "DEV.APP.SVRCONN"));
    cf.setAppName("msg-retry");
    cf.setBooleanProperty(USER_AUTHENTICATION_MQCSP, true);
    cf.setStringProperty(USERID, System.getenv().getOrDefault("MQ_USER", "app"));
    cf.setStringProperty(PASSWORD, System.getenv().getOrDefault("MQ_PASS", "passw0rd"));

    // Reconnect transparently; receivers keep their listeners across queue manager restarts
    cf.setIntProperty(WMQ_CLIENT_RECONNECT_OPTIONS, WMQ_CLIENT_RECONNECT);
    cf.setIntProperty(WMQ_SHARE_CONV_ALLOWED, WMQ_SHARE_CONV_ALLOWED_YES);

    return cf;
  }
}
