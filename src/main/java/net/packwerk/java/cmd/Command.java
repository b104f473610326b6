// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.packwerk.java.cmd;

/** The commands of the command line tool. Names are matched case-insensitively. */
public enum Command {
  /** Prints the name of every pack, longest name first. */
  LIST_PACKS,
  /** Prints the project-relative path of every file that is analyzed. */
  LIST_INCLUDED_FILES,
  /** Prints every constant reference with its module nesting and owning pack. */
  LIST_REFERENCES,
  /** Prints every constant defined by a class or constant assignment, with where it is defined. */
  LIST_DEFINITIONS
}
