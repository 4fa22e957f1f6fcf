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
 * Lifecycle of a {@link MultiPartFormDataDecoder}.
 */
public enum DecoderState
{
  //Looking for the first boundary. Preamble bytes are dropped.
  PRE_BOUNDARY,
  //A boundary line was read, waiting for the blank line that ends the part headers.
  IN_HEADERS,
  //Streaming the body of the current part.
  IN_BODY,
  //The terminal boundary was read. The rest of that chunk is epilogue and later chunks are rejected.
  DONE,
  //An error occurred. Every later call rethrows it.
  FAILED
}
