package com.qqsuccubus.beacon.node.ws;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.websocket.WebsocketOutbound;

/**
 * Outbound side of one stream connection: text frames, then a close frame.
 */
interface FrameSink {

	/**
	 * @return completes when every frame was written, errors when the transport fails
	 */
	Mono<Void> sendFrames(Flux<String> frames);

	Mono<Void> sendClose(int code, String reason);

	static FrameSink of(WebsocketOutbound outbound) {
		return new FrameSink() {
			@Override
			public Mono<Void> sendFrames(Flux<String> frames) {
				return outbound.sendString(frames).then();
			}

			@Override
			public Mono<Void> sendClose(int code, String reason) {
				return outbound.sendClose(code, reason);
			}
		};
	}
}
