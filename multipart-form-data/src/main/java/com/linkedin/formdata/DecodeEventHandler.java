/*
   Copyright (c) 2015 LinkedIn Corp.

   Licensed under the Apache License, Version 2.0 (the "License");
   you may not use this file except in compliance with the License.
   You may obtain a copy of the License at

       http://www.apache.org/licenses/LICENSE-2.0

   Unless required by applicable law or agreed to in writing, software
   distributed under the License is distributed on an "AS IS" BASIS,
   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
   See the License for the specific language governing permissions and
   limitations under the License.
*/

package com.linkedin.formdata;


/**
 * Receives the events of a {@link MultiPartFormDataDecoder} in order. For each part this is exactly one
 * {@link #onPartStarted(DecodeEvent.PartStarted)}, zero or more {@link #onBodyChunk(DecodeEvent.BodyChunk)} and exactly
 * one {@link #onPartEnded(DecodeEvent.PartEnded)}.
 *
 * Any exception thrown here moves the decoder to {@link DecoderState#FAILED} and reaches the caller of
 * {@link MultiPartFormDataDecoder#feed(com.linkedin.data.ByteString, DecodeEventHandler)}, wrapped in a
 * {@link com.linkedin.formdata.exceptions.DecodeException} unless it already is a
 * {@link com.linkedin.formdata.exceptions.MultiPartFormDataException}.
 */
public interface DecodeEventHandler
{
  void onPartStarted(DecodeEvent.PartStarted partStarted);

  /**
   * The chunk is never empty.
   */
  void onBodyChunk(DecodeEvent.BodyChunk bodyChunk);

  void onPartEnded(DecodeEvent.PartEnded partEnded);
}
