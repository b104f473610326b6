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

package net.packwerk.java.packs;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link PackDiscovery}. */
@RunWith(JUnit4.class)
public final class PackDiscoveryTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private Path root;

  @Before
  public void setUp() throws IOException {
    root = tmp.getRoot().toPath().toAbsolutePath().normalize();
  }

  private Path touch(String relativePath) throws IOException {
    Path path = root.resolve(relativePath);
    Files.createDirectories(path.getParent());
    Files.write(path, new byte[0]);
    return path;
  }

  @Test
  public void testDiscoverPacks() throws Exception {
    touch("package.yml");
    touch("packs/foo/package.yml");
    touch("packs/foo/nested/package.yml");
    touch("packs/bar/app/bar.rb");
    touch("node_modules/some_lib/package.yml");
    touch("vendor/bundle/gem/package.yml");

    ImmutableList<Pack> packs = new PackDiscovery(root).discoverPacks();

    assertThat(packs.stream().map(Pack::name).collect(toImmutableList()))
        .containsExactly(".", "packs/foo/nested", "packs/foo")
        .inOrder();
    assertThat(packs.get(0).yml()).isEqualTo(root.resolve("package.yml"));
    assertThat(packs.get(0).isRoot()).isTrue();
    assertThat(packs.get(2).recordedViolations()).isEmpty();
  }

  @Test
  public void testNoPacks() throws Exception {
    touch("app/models/foo.rb");

    assertThat(new PackDiscovery(root).discoverPacks()).isEmpty();
  }

  @Test
  public void testOwningPackageYmls() throws Exception {
    touch("package.yml");
    touch("packs/foo/package.yml");
    touch("packs/foo/nested/package.yml");
    Path fooFile = touch("packs/foo/app/models/foo.rb");
    Path nestedFile = touch("packs/foo/nested/lib/nested.rb");
    Path rootFile = touch("lib/tasks/root.rb");
    ImmutableList<Pack> packs = new PackDiscovery(root).discoverPacks();

    ImmutableMap<Path, Path> owners =
        PackDiscovery.owningPackageYmls(ImmutableList.of(fooFile, nestedFile, rootFile), packs);

    assertThat(owners)
        .containsExactly(
            fooFile, root.resolve("packs/foo/package.yml"),
            nestedFile, root.resolve("packs/foo/nested/package.yml"),
            rootFile, root.resolve("package.yml"));
  }

  @Test
  public void testFilesOutsideEveryPackAreUnowned() throws Exception {
    touch("packs/foo/package.yml");
    Path stray = touch("lib/stray.rb");
    ImmutableList<Pack> packs = new PackDiscovery(root).discoverPacks();

    assertThat(PackDiscovery.owningPackageYmls(ImmutableList.of(stray), packs)).isEmpty();
  }
}
