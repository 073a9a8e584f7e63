package com.vexrobotics.aimconnector;

public interface TransportFactory {

    ChannelTransport create(Channel channel);
    void shutdown(); //release resources shared by the transports

}
