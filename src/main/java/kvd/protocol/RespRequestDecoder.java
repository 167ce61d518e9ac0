package kvd.protocol;

import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageDecoder;

import java.util.List;

/**
 * Turns each top-level value from {@link RespDecoder} into a {@link RespRequest}.
 * Anything that is not a command array is a {@link ProtocolException}.
 */
@ChannelHandler.Sharable
public class RespRequestDecoder extends MessageToMessageDecoder<RespValue> {

    @Override
    protected void decode(ChannelHandlerContext ctx, RespValue msg, List<Object> out) {
        out.add(RespRequest.fromValue(msg));
    }
}
