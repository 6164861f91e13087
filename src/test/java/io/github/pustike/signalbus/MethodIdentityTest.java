/*
 * Copyright (C) 2026 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.github.pustike.signalbus;

import junit.framework.TestCase;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.truth.Truth.assertThat;

/**
 * Tests for {@link MethodIdentity}.
 */
public class MethodIdentityTest extends TestCase {

    public void testMethodReferencesFromDifferentSitesAreEqual() {
        EventHandler<Speaker, StringEvent> first = Speaker::say;
        EventHandler<Speaker, StringEvent> second = Speaker::say;
        assertNotSame(first.getClass(), second.getClass());

        MethodIdentity identity = MethodIdentity.of(first);
        assertEquals(identity, MethodIdentity.of(second));
        assertEquals(identity.hashCode(), MethodIdentity.of(second).hashCode());
        assertEquals(Speaker.class.getName(), identity.getDeclaringClass());
        assertEquals("say", identity.getMethodName());
    }

    public void testDifferentMethodsDiffer() {
        assertFalse(MethodIdentity.of((EventHandler<Speaker, StringEvent>) Speaker::say)
                .equals(MethodIdentity.of((EventHandler<Speaker, StringEvent>) Speaker::shout)));
    }

    public void testLambdasAreIdentifiedBySiteAndCaptures() {
        EventHandler<Speaker, StringEvent> first = (speaker, event) -> speaker.say(event);
        EventHandler<Speaker, StringEvent> second = (speaker, event) -> speaker.say(event);
        assertFalse(MethodIdentity.of(first).equals(MethodIdentity.of(second)));

        List<MethodIdentity> differentCaptures = new ArrayList<>();
        List<MethodIdentity> sameCapture = new ArrayList<>();
        String shared = "#shared";
        for (int i = 0; i < 2; i++) {
            String suffix = "#" + i;
            EventHandler<Speaker, StringEvent> capturing = (speaker, event) -> speaker.say(
                    new StringEvent(event.getText() + suffix));
            differentCaptures.add(MethodIdentity.of(capturing));
            EventHandler<Speaker, StringEvent> capturingShared = (speaker, event) -> speaker.say(
                    new StringEvent(event.getText() + shared));
            sameCapture.add(MethodIdentity.of(capturingShared));
        }
        assertFalse("Different captured values make different functions.",
                differentCaptures.get(0).equals(differentCaptures.get(1)));
        assertEquals(sameCapture.get(0), sameCapture.get(1));
        assertEquals(sameCapture.get(0).hashCode(), sameCapture.get(1).hashCode());
    }

    public void testCapturedPrimitivesAreComparedByValue() {
        List<MethodIdentity> identities = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
            int limit = 1000;
            EventHandler<Speaker, StringEvent> capturing = (speaker, event) -> speaker.say(
                    new StringEvent(event.getText().substring(0, Math.min(limit, event.getText().length()))));
            identities.add(MethodIdentity.of(capturing));
        }
        assertEquals(identities.get(0), identities.get(1));
        assertEquals(identities.get(0).hashCode(), identities.get(1).hashCode());
    }

    public void testBoundReceiversAreComparedByIdentity() {
        EventBusTest.Router r1 = new EventBusTest.Router("r1");
        EventBusTest.Router r2 = new EventBusTest.Router("r2");
        EventHandler<Speaker, StringEvent> first = r1::route;
        EventHandler<Speaker, StringEvent> again = r1::route;
        EventHandler<Speaker, StringEvent> other = r2::route;

        assertEquals(MethodIdentity.of(first), MethodIdentity.of(again));
        assertFalse(MethodIdentity.of(first).equals(MethodIdentity.of(other)));
    }

    public void testNamedClassIsIdentifiedByInstance() {
        SayHandler handler = new SayHandler();
        MethodIdentity identity = MethodIdentity.of(handler);
        assertEquals(identity, MethodIdentity.of(handler));
        assertFalse(identity.equals(MethodIdentity.of(new SayHandler())));
        assertEquals(SayHandler.class.getName(), identity.getDeclaringClass());
    }

    public void testNamedClassHandlerCanBeUnbound() {
        EventBus bus = new EventBus();
        Speaker speaker = new Speaker();
        SayHandler handler = new SayHandler();
        bus.bind(StringEvent.class, speaker, handler);

        bus.unbind(StringEvent.class, speaker, new SayHandler());
        assertTrue(bus.hasSubscribers(StringEvent.class));

        bus.unbind(StringEvent.class, speaker, handler);
        assertFalse(bus.hasSubscribers(StringEvent.class));
    }

    public void testToString() {
        MethodIdentity identity = MethodIdentity.of((EventHandler<Speaker, StringEvent>) Speaker::say);
        assertThat(identity.toString()).isEqualTo(
                Speaker.class.getName() + "::say(L" + StringEvent.class.getName().replace('.', '/') + ";)V");
    }

    public static final class SayHandler implements EventHandler<Speaker, StringEvent> {
        private static final long serialVersionUID = 1L;

        @Override
        public void handle(Speaker subscriber, StringEvent event) {
            subscriber.say(event);
        }
    }
}
